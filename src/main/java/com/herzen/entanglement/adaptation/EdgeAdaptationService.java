package com.herzen.entanglement.adaptation;

import com.herzen.entanglement.domain.ConceptGraphModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.herzen.entanglement.domain.ConceptGraphModels.clampUnit;

/**
 * Learns edge strength from observed traversal outcomes.
 */
@Service
public class EdgeAdaptationService {
    private static final Logger log = LoggerFactory.getLogger(EdgeAdaptationService.class);

    static final double PRIOR_TRANSFER = 0.7;
    static final double PRIOR_STRENGTH = 3.0;
    static final long WARM_UP_TRAVERSALS = 3;
    static final double WEIGHT_FLOOR = 0.3;
    // a perfect transfer is assumed to keep 80% of the source score
    static final double EXPECTED_TRANSFER = 0.8;

    private final Clock clock;

    public EdgeAdaptationService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Counts the outcome on the from→to edge and charges it to the source concept's cascade counters.
     * {@code transferCoefficient} and {@code weight} only move once the edge has three or more traversals.
     * Without such an edge the graph is returned unchanged.
     */
    public ConceptEntanglementGraph updateEdgeWeights(ConceptEntanglementGraph graph, String fromConceptId,
                                                      String toConceptId, boolean success) {
        ConceptEdge edge = graph.edge(fromConceptId, toConceptId).orElse(null);
        if (edge == null) return graph;

        long successful = edge.successfulTraversals() + (success ? 1 : 0);
        long difficult = edge.difficultTraversals() + (success ? 0 : 1);
        long total = successful + difficult;

        double transfer = edge.transferCoefficient();
        double weight = edge.weight();
        if (total >= WARM_UP_TRAVERSALS) {
            double observedRate = (double) successful / total;
            double priorWeight = PRIOR_STRENGTH / (total + PRIOR_STRENGTH);
            transfer = clampUnit(PRIOR_TRANSFER * priorWeight + observedRate * (1 - priorWeight));
            weight = clampUnit(WEIGHT_FLOOR + (1 - WEIGHT_FLOOR) * transfer);
        }

        ConceptEdge updated = new ConceptEdge(edge.id(), edge.from(), edge.to(), edge.type(), weight, transfer,
                successful, difficult, edge.label());
        List<ConceptEdge> edges = new ArrayList<>(graph.edges());
        edges.set(edges.indexOf(edge), updated);

        Map<String, ConceptEntanglement> entanglements = graph.entanglements();
        ConceptEntanglement source = entanglements.get(fromConceptId);
        if (source != null) {
            entanglements = new LinkedHashMap<>(entanglements);
            entanglements.put(fromConceptId, source.withCascadeOutcome(success));
        }

        log.debug("Edge {} now {} ok / {} difficult, transfer {}", edge.id(), successful, difficult, transfer);
        return graph.withEdgesAndEntanglements(edges, entanglements, clock.instant());
    }

    public ConceptEntanglementGraph recordTransferPattern(ConceptEntanglementGraph graph, String fromConcept,
                                                          String toConcept, double fromScore, double toScore) {
        double observed = clampUnit(toScore / Math.max(1.0, fromScore * EXPECTED_TRANSFER));
        Instant now = clock.instant();
        String id = LearningTransferPattern.patternId(fromConcept, toConcept);

        List<LearningTransferPattern> patterns = new ArrayList<>(graph.transferPatterns());
        for (int i = 0; i < patterns.size(); i++) {
            LearningTransferPattern p = patterns.get(i);
            if (!p.fromConcept().equals(fromConcept) || !p.toConcept().equals(toConcept)) continue;

            long n = p.sampleSize() + 1;
            double rate = (p.transferRate() * p.sampleSize() + observed) / n;
            ScoreMoments moments = p.moments().add(fromScore, toScore);
            patterns.set(i, new LearningTransferPattern(p.id(), fromConcept, toConcept, clampUnit(rate), n,
                    moments.correlation(n), moments, now));
            return graph.withTransferPatterns(patterns, now);
        }

        patterns.add(new LearningTransferPattern(id, fromConcept, toConcept, observed, 1, 0.0,
                ScoreMoments.EMPTY.add(fromScore, toScore), now));
        return graph.withTransferPatterns(patterns, now);
    }

    /**
     * Both halves of one reported traversal: edge adaptation, then the transfer pattern.
     */
    public ConceptEntanglementGraph recordTransfer(ConceptEntanglementGraph graph, String fromConcept, String toConcept,
                                                   double fromScore, double toScore, boolean success) {
        ConceptEntanglementGraph updated = updateEdgeWeights(graph, fromConcept, toConcept, success);
        return recordTransferPattern(updated, fromConcept, toConcept, fromScore, toScore);
    }
}
