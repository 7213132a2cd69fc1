package com.herzen.entanglement.analysis;

import com.herzen.entanglement.analysis.AnalysisModels.AffectedConcept;
import com.herzen.entanglement.analysis.AnalysisModels.ForwardImpactResult;
import com.herzen.entanglement.analysis.AnalysisModels.ImpactLevel;
import com.herzen.entanglement.config.EntanglementProperties;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptEdge;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptEntanglementGraph;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

import static com.herzen.entanglement.domain.ConceptGraphModels.clampScore;

/**
 * Breadth-first projection of a comprehension gap onto dependent concepts.
 */
@Service
public class ForwardImpactAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ForwardImpactAnalyzer.class);

    static final double DEFAULT_EDGE_WEIGHT = 0.5;
    static final double DEFAULT_TRANSFER = 0.7;
    static final double DEPTH_DECAY = 0.8;

    private final int defaultMaxDepth;

    public ForwardImpactAnalyzer(EntanglementProperties properties) {
        this.defaultMaxDepth = properties.analysis().defaultMaxDepth();
    }

    public ForwardImpactResult analyzeForwardImpact(ConceptEntanglementGraph graph, String sourceConceptId) {
        return analyzeForwardImpact(graph, sourceConceptId, defaultMaxDepth);
    }

    /**
     * Dependents at most {@code maxDepth} links away are reported; each concept once, at its shortest distance.
     */
    public ForwardImpactResult analyzeForwardImpact(ConceptEntanglementGraph graph, String sourceConceptId, int maxDepth) {
        Objects.requireNonNull(graph, "graph");
        double sourceGap = graph.entanglement(sourceConceptId)
                .map(e -> 100 - e.comprehensionScore())
                .orElse(50.0);

        List<AffectedConcept> affected = new ArrayList<>();
        List<String> critical = new ArrayList<>();
        Set<String> discovered = new HashSet<>();
        discovered.add(sourceConceptId);
        Deque<Frontier> queue = new ArrayDeque<>();
        queue.add(new Frontier(sourceConceptId, 0));

        while (!queue.isEmpty()) {
            Frontier current = queue.poll();
            if (current.depth() >= maxDepth) continue;
            ConceptNode node = graph.nodes().get(current.conceptId());
            if (node == null) continue;

            for (String dependentId : node.dependents()) {
                ConceptNode dependent = graph.nodes().get(dependentId);
                if (dependent == null || !discovered.add(dependentId)) continue;

                Optional<ConceptEdge> edge = graph.edge(current.conceptId(), dependentId);
                double weight = edge.map(ConceptEdge::weight).orElse(DEFAULT_EDGE_WEIGHT);
                double transfer = edge.map(ConceptEdge::transferCoefficient).orElse(DEFAULT_TRANSFER);
                double reduction = estimateReduction(sourceGap, transfer, weight, current.depth());
                ImpactLevel level = impactLevel(reduction);

                affected.add(new AffectedConcept(dependentId, level, reduction, current.depth() + 1));
                if (dependent.dependents().size() > 2 && level == ImpactLevel.HIGH) {
                    critical.add(dependentId);
                }
                queue.add(new Frontier(dependentId, current.depth() + 1));
            }
        }

        affected.sort(Comparator.comparing(AffectedConcept::impactLevel)
                .thenComparingInt(AffectedConcept::pathLength));

        log.debug("Forward impact from {} (gap {}): {} concept(s) at risk", sourceConceptId, sourceGap, affected.size());
        return new ForwardImpactResult(sourceConceptId, List.copyOf(affected), affected.size(), List.copyOf(critical));
    }

    static double estimateReduction(double sourceGap, double transferCoefficient, double weight, int depth) {
        return clampScore(sourceGap * transferCoefficient * Math.pow(DEPTH_DECAY, depth) * weight);
    }

    static ImpactLevel impactLevel(double reduction) {
        if (reduction > 30) return ImpactLevel.HIGH;
        if (reduction > 15) return ImpactLevel.MEDIUM;
        return ImpactLevel.LOW;
    }

    private record Frontier(String conceptId, int depth) {}
}
