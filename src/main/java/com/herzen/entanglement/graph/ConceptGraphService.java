package com.herzen.entanglement.graph;

import com.herzen.entanglement.domain.ConceptGraphModels.*;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
public class ConceptGraphService {
    public static final int GRAPH_VERSION = 1;

    private final Clock clock;

    public ConceptGraphService(Clock clock) {
        this.clock = clock;
    }

    public ConceptEntanglementGraph createEmptyGraph(String courseId, String userId) {
        Objects.requireNonNull(courseId, "courseId");
        return new ConceptEntanglementGraph(Map.of(), Map.of(), List.of(), List.of(), List.of(),
                new GraphMetadata(courseId, userId, clock.instant(), GRAPH_VERSION));
    }

    /**
     * Overwrites a node with the same id. An existing entanglement is kept; a missing one starts as unknown.
     */
    public ConceptEntanglementGraph addConceptNode(ConceptEntanglementGraph graph, ConceptNode node) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(node, "node");
        return graph.withNode(node, clock.instant());
    }

    /**
     * No cycle check here; traversals guard themselves with visited sets.
     */
    public ConceptEntanglementGraph addConceptEdge(ConceptEntanglementGraph graph, EdgeSpec edge) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(edge, "edge");
        Objects.requireNonNull(edge.type(), "edge.type");
        return graph.withEdge(ConceptEdge.from(edge), clock.instant());
    }

    public ConceptEntanglementGraph addAll(ConceptEntanglementGraph graph, List<ConceptNode> nodes, List<EdgeSpec> edges) {
        ConceptEntanglementGraph updated = graph;
        for (ConceptNode node : nodes) {
            updated = addConceptNode(updated, node);
        }
        for (EdgeSpec edge : edges) {
            updated = addConceptEdge(updated, edge);
        }
        return updated;
    }

    /**
     * Overrides a concept's comprehension with an externally assessed level. Ignored for unknown concepts.
     */
    public ConceptEntanglementGraph assessConcept(ConceptEntanglementGraph graph, String conceptId,
                                                  double score, double confidence, long attempts) {
        ConceptEntanglement current = graph.entanglements().get(conceptId);
        if (current == null) return graph;
        ConceptEntanglement assessed = new ConceptEntanglement(conceptId, null, score, confidence, attempts,
                current.timeSpentMs(), current.signals(), current.lastInteraction(),
                current.cascadeFailures(), current.cascadeSuccesses());
        return graph.withEntanglement(assessed, clock.instant());
    }
}
