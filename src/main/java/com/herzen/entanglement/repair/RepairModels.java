package com.herzen.entanglement.repair;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public class RepairModels {
    public enum StepPriority { REQUIRED, RECOMMENDED, OPTIONAL }

    public enum ActivityType { REVIEW, QUIZ, PRACTICE, VIDEO }

    public record Activity(ActivityType type, String description) {}

    public record RepairStep(String conceptId, String reason, int estimatedMinutes, StepPriority priority,
                             List<Activity> activities) {}

    public record RepairPath(String id,
                             String targetConceptId,
                             List<RepairStep> steps,
                             int totalEstimatedMinutes,
                             int expectedImprovement,
                             Instant generatedAt,
                             Set<String> completedConceptIds) {
        public RepairPath {
            steps = List.copyOf(steps);
            completedConceptIds = completedConceptIds == null ? Set.of() : Set.copyOf(completedConceptIds);
        }

        @JsonIgnore
        public boolean isComplete() {
            return steps.stream().allMatch(s -> completedConceptIds.contains(s.conceptId()));
        }
    }
}
