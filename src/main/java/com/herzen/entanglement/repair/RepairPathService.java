package com.herzen.entanglement.repair;

import com.herzen.entanglement.analysis.AnalysisModels.RootCause;
import com.herzen.entanglement.analysis.AnalysisModels.RootCauseResult;
import com.herzen.entanglement.analysis.AnalysisModels.Severity;
import com.herzen.entanglement.analysis.RootCauseAnalyzer;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptEntanglement;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptEntanglementGraph;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptNode;
import com.herzen.entanglement.domain.ConceptGraphModels.EntanglementState;
import com.herzen.entanglement.repair.RepairModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Builds remediation plans from a root-cause diagnosis and tracks the plans a learner is working through.
 * Ordering is greedy: root causes by confidence, then bridging concepts, then the target.
 */
@Service
public class RepairPathService {
    private static final Logger log = LoggerFactory.getLogger(RepairPathService.class);

    static final int BRIDGE_MINUTES = 8;
    static final int TARGET_MINUTES = 10;
    static final double BRIDGE_SCORE_THRESHOLD = 70;

    private final Clock clock;
    private final RootCauseAnalyzer rootCauseAnalyzer;

    public RepairPathService(Clock clock, RootCauseAnalyzer rootCauseAnalyzer) {
        this.clock = clock;
        this.rootCauseAnalyzer = rootCauseAnalyzer;
    }

    public RepairPath generateRepairPath(ConceptEntanglementGraph graph, String targetConceptId, RootCauseResult diagnosis) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(diagnosis, "diagnosis");
        List<RepairStep> steps = new ArrayList<>();
        Set<String> covered = new HashSet<>();

        List<RootCause> causes = new ArrayList<>(diagnosis.rootCauses());
        causes.sort(Comparator.comparingDouble(RootCause::confidence).reversed());
        for (RootCause cause : causes) {
            if (covered.contains(cause.conceptId())) continue;
            ConceptNode node = graph.nodes().get(cause.conceptId());
            ConceptEntanglement e = graph.entanglements().get(cause.conceptId());
            if (node == null || e == null) continue;

            covered.add(cause.conceptId());
            steps.add(new RepairStep(cause.conceptId(), reasonFor(cause.severity()), minutesFor(e.state()),
                    priorityFor(cause.severity()), activitiesFor(node, e.state())));
        }

        for (String conceptId : diagnosis.causationChain()) {
            if (covered.contains(conceptId) || conceptId.equals(targetConceptId)) continue;
            ConceptNode node = graph.nodes().get(conceptId);
            ConceptEntanglement e = graph.entanglements().get(conceptId);
            if (node == null || e == null || e.comprehensionScore() >= BRIDGE_SCORE_THRESHOLD) continue;

            covered.add(conceptId);
            steps.add(new RepairStep(conceptId, "Bridges the gap between root cause and target", BRIDGE_MINUTES,
                    StepPriority.RECOMMENDED, List.of(
                    new Activity(ActivityType.REVIEW, "Quick review of \"" + node.title() + "\""),
                    new Activity(ActivityType.QUIZ, "Verify understanding"))));
        }

        ConceptNode target = graph.nodes().get(targetConceptId);
        if (target != null && !covered.contains(targetConceptId)) {
            steps.add(new RepairStep(targetConceptId, "Your goal - ready to master this concept", TARGET_MINUTES,
                    StepPriority.REQUIRED, List.of(
                    new Activity(ActivityType.REVIEW, "Approach \"" + target.title() + "\" with fresh understanding"),
                    new Activity(ActivityType.PRACTICE, "Apply what you've learned"))));
        }

        int totalMinutes = steps.stream().mapToInt(RepairStep::estimatedMinutes).sum();
        long required = steps.stream().filter(s -> s.priority() == StepPriority.REQUIRED).count();
        int expectedImprovement = (int) Math.min(40, required * 15);

        Instant now = clock.instant();
        return new RepairPath("repair_" + targetConceptId + "_" + now.toEpochMilli(), targetConceptId, steps,
                totalMinutes, expectedImprovement, now, Set.of());
    }

    /**
     * Diagnoses the target, generates a path for it and makes it active.
     */
    public StartedRepair startRepairPath(ConceptEntanglementGraph graph, String targetConceptId) {
        RootCauseResult diagnosis = rootCauseAnalyzer.findRootCause(graph, targetConceptId);
        RepairPath path = generateRepairPath(graph, targetConceptId, diagnosis);
        List<RepairPath> active = new ArrayList<>(graph.activeRepairPaths());
        active.add(path);
        log.info("Started repair path {} with {} step(s)", path.id(), path.steps().size());
        return new StartedRepair(graph.withRepairPaths(active, clock.instant()), path);
    }

    /**
     * Marks a step done; the path leaves the active list once all of its steps are done.
     * Unknown path or concept ids leave the graph unchanged.
     */
    public ConceptEntanglementGraph completeRepairStep(ConceptEntanglementGraph graph, String repairPathId, String conceptId) {
        List<RepairPath> active = new ArrayList<>(graph.activeRepairPaths());
        for (int i = 0; i < active.size(); i++) {
            RepairPath path = active.get(i);
            if (!path.id().equals(repairPathId)) continue;
            boolean hasStep = path.steps().stream().anyMatch(s -> s.conceptId().equals(conceptId));
            if (!hasStep) return graph;

            Set<String> done = new HashSet<>(path.completedConceptIds());
            done.add(conceptId);
            RepairPath progressed = new RepairPath(path.id(), path.targetConceptId(), path.steps(),
                    path.totalEstimatedMinutes(), path.expectedImprovement(), path.generatedAt(), done);
            if (progressed.isComplete()) {
                active.remove(i);
                log.info("Repair path {} completed", repairPathId);
            } else {
                active.set(i, progressed);
            }
            return graph.withRepairPaths(active, clock.instant());
        }
        return graph;
    }

    public ConceptEntanglementGraph dismissRepairPath(ConceptEntanglementGraph graph, String repairPathId) {
        List<RepairPath> remaining = graph.activeRepairPaths().stream()
                .filter(p -> !p.id().equals(repairPathId))
                .toList();
        if (remaining.size() == graph.activeRepairPaths().size()) return graph;
        log.info("Dismissed repair path {}", repairPathId);
        return graph.withRepairPaths(remaining, clock.instant());
    }

    public Optional<RepairPath> activeRepairPath(ConceptEntanglementGraph graph, String targetConceptId) {
        return graph.activeRepairPaths().stream()
                .filter(p -> p.targetConceptId().equals(targetConceptId))
                .findFirst();
    }

    static StepPriority priorityFor(Severity severity) {
        return severity == Severity.MINOR ? StepPriority.RECOMMENDED : StepPriority.REQUIRED;
    }

    static String reasonFor(Severity severity) {
        return switch (severity) {
            case CRITICAL -> "Critical gap - this concept needs complete review";
            case MAJOR -> "Major gap - focused practice needed";
            case MINOR -> "Minor gap - quick review recommended";
        };
    }

    static int minutesFor(EntanglementState state) {
        return switch (state) {
            case COLLAPSED -> 20;
            case STRUGGLING -> 15;
            case UNSTABLE -> 10;
            default -> 5;
        };
    }

    static List<Activity> activitiesFor(ConceptNode node, EntanglementState state) {
        List<Activity> activities = new ArrayList<>();
        if (state == EntanglementState.COLLAPSED) {
            activities.add(new Activity(ActivityType.VIDEO, "Re-watch the explanation for \"" + node.title() + "\""));
            activities.add(new Activity(ActivityType.REVIEW, "Review key concepts and examples"));
        }
        if (state.isStruggling()) {
            activities.add(new Activity(ActivityType.PRACTICE, "Complete guided practice exercises"));
        }
        activities.add(new Activity(ActivityType.QUIZ, "Verify understanding with a short quiz"));
        return List.copyOf(activities);
    }

    public record StartedRepair(ConceptEntanglementGraph graph, RepairPath path) {}
}
