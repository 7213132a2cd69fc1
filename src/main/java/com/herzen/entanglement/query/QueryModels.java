package com.herzen.entanglement.query;

import com.herzen.entanglement.domain.ConceptGraphModels.ConceptEntanglement;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptNode;

import java.util.List;

public class QueryModels {
    public record ConceptStatus(ConceptNode concept, ConceptEntanglement entanglement) {}

    public record GraphHealth(int score,
                              int masteredCount,
                              int stableCount,
                              int unstableCount,
                              int strugglingCount,
                              int collapsedCount,
                              int unknownCount,
                              List<String> recommendations) {}
}
