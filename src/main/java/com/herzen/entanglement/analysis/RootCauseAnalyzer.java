package com.herzen.entanglement.analysis;

import com.herzen.entanglement.analysis.AnalysisModels.RootCause;
import com.herzen.entanglement.analysis.AnalysisModels.RootCauseResult;
import com.herzen.entanglement.analysis.AnalysisModels.Severity;
import com.herzen.entanglement.config.EntanglementProperties;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptEntanglement;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptEntanglementGraph;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptNode;
import com.herzen.entanglement.domain.ConceptGraphModels.EntanglementState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;

import static com.herzen.entanglement.domain.ConceptGraphModels.clampUnit;

/**
 * Walks prerequisite links backwards from a struggling concept and ranks the problematic prerequisites
 * found on the way. Every concept is expanded at most once per call.
 */
@Service
public class RootCauseAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(RootCauseAnalyzer.class);

    private final Clock clock;
    private final int defaultMaxDepth;

    public RootCauseAnalyzer(Clock clock, EntanglementProperties properties) {
        this.clock = clock;
        this.defaultMaxDepth = properties.analysis().defaultMaxDepth();
    }

    public RootCauseResult findRootCause(ConceptEntanglementGraph graph, String triggerConceptId) {
        return findRootCause(graph, triggerConceptId, defaultMaxDepth);
    }

    public RootCauseResult findRootCause(ConceptEntanglementGraph graph, String triggerConceptId, int maxDepth) {
        Objects.requireNonNull(graph, "graph");
        Trace trace = new Trace(graph, Math.max(0, maxDepth), triggerConceptId);
        List<String> path = new ArrayList<>();
        path.add(triggerConceptId);
        trace.traceBack(triggerConceptId, 0, path);

        List<RootCause> ranked = new ArrayList<>(trace.causes.values());
        ranked.sort(Comparator.comparingDouble(RootCause::confidence).reversed());

        log.debug("Root cause analysis for {}: {} candidate(s), chain {}", triggerConceptId, ranked.size(), trace.chain);
        return new RootCauseResult(triggerConceptId, List.copyOf(ranked), List.copyOf(trace.chain), clock.instant());
    }

    static RootCause evaluate(String conceptId, ConceptEntanglement e, int depth, int maxDepth) {
        double cascadeRatio = (double) e.cascadeFailures() / Math.max(1, e.attempts());
        double scoreGap = 100 - e.comprehensionScore();
        double depthFactor = 1.0 - (double) depth / (maxDepth + 1);
        double confidence = clampUnit(cascadeRatio * 0.3 + (scoreGap / 100) * 0.4 + depthFactor * 0.3);

        Severity severity = switch (e.state()) {
            case COLLAPSED -> Severity.CRITICAL;
            case STRUGGLING -> Severity.MAJOR;
            default -> Severity.MINOR;
        };
        return new RootCause(conceptId, confidence, evidence(e), severity);
    }

    static List<String> evidence(ConceptEntanglement e) {
        List<String> evidence = new ArrayList<>();
        if (e.state() == EntanglementState.COLLAPSED) {
            evidence.add("This concept has collapsed - needs complete review");
        }
        if (e.cascadeFailures() > 2) {
            evidence.add("Caused " + e.cascadeFailures() + " downstream failures");
        }
        if (e.comprehensionScore() < 40) {
            evidence.add(String.format(Locale.ROOT, "Low comprehension score: %.0f%%", e.comprehensionScore()));
        }
        if (e.attempts() > 5 && e.comprehensionScore() < 60) {
            evidence.add("Multiple attempts (" + e.attempts() + ") with limited progress");
        }
        return List.copyOf(evidence);
    }

    private static final class Trace {
        private final ConceptEntanglementGraph graph;
        private final int maxDepth;
        private final Set<String> visited = new HashSet<>();
        // insertion order breaks confidence ties
        private final Map<String, RootCause> causes = new LinkedHashMap<>();
        private List<String> chain;
        private double bestConfidence = -1.0;

        private Trace(ConceptEntanglementGraph graph, int maxDepth, String triggerConceptId) {
            this.graph = graph;
            this.maxDepth = maxDepth;
            this.chain = List.of(triggerConceptId);
        }

        private void traceBack(String conceptId, int depth, List<String> pathToHere) {
            if (depth > maxDepth || !visited.add(conceptId)) return;

            ConceptNode node = graph.nodes().get(conceptId);
            if (node == null || !graph.entanglements().containsKey(conceptId)) return;

            for (String prereqId : node.prerequisites()) {
                ConceptEntanglement prereq = graph.entanglements().get(prereqId);
                if (prereq == null) continue;

                if (prereq.state().isProblematic()) {
                    RootCause candidate = evaluate(prereqId, prereq, depth, maxDepth);
                    RootCause known = causes.get(prereqId);
                    if (known == null || candidate.confidence() > known.confidence()) {
                        causes.put(prereqId, candidate);
                    }
                    if (candidate.confidence() > bestConfidence) {
                        bestConfidence = candidate.confidence();
                        List<String> nextChain = new ArrayList<>(pathToHere);
                        nextChain.add(prereqId);
                        Collections.reverse(nextChain);
                        chain = nextChain;
                    }
                }

                List<String> nextPath = new ArrayList<>(pathToHere);
                nextPath.add(prereqId);
                traceBack(prereqId, depth + 1, nextPath);
            }
        }
    }
}
