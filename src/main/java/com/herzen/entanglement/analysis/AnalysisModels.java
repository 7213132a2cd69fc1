package com.herzen.entanglement.analysis;

import java.time.Instant;
import java.util.List;

public class AnalysisModels {
    public enum Severity { CRITICAL, MAJOR, MINOR }

    public record RootCause(String conceptId, double confidence, List<String> evidence, Severity severity) {}

    public record RootCauseResult(String triggerConceptId,
                                  List<RootCause> rootCauses,
                                  List<String> causationChain,
                                  Instant analysisTimestamp) {}

    /**
     * Declared in sort order: high impact first.
     */
    public enum ImpactLevel { HIGH, MEDIUM, LOW }

    public record AffectedConcept(String conceptId, ImpactLevel impactLevel, double estimatedScoreReduction, int pathLength) {}

    public record ForwardImpactResult(String sourceConceptId,
                                      List<AffectedConcept> affectedConcepts,
                                      int totalAtRisk,
                                      List<String> criticalPathAffected) {}
}
