package com.herzen.entanglement.scoring;

import com.herzen.entanglement.domain.ConceptGraphModels.ConceptEntanglement;
import com.herzen.entanglement.domain.ConceptGraphModels.ConceptEntanglementGraph;
import com.herzen.entanglement.domain.ConceptGraphModels.EntanglementState;
import com.herzen.entanglement.scoring.ScoringModels.Comprehension;
import com.herzen.entanglement.scoring.ScoringModels.SignalScore;
import com.herzen.entanglement.signal.BehaviorSignals.*;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.herzen.entanglement.domain.ConceptGraphModels.clampScore;
import static com.herzen.entanglement.domain.ConceptGraphModels.clampUnit;

/**
 * Turns behaviour signals into a comprehension score and keeps per-concept entanglement state current.
 */
@Service
public class ComprehensionScoringService {
    public static final int SIGNAL_WINDOW = 50;

    private static final double NEUTRAL_SCORE = 50.0;
    private static final long DECAY_HORIZON_MS = Duration.ofDays(7).toMillis();
    private static final long ASSUMED_VIDEO_MS = Duration.ofMinutes(10).toMillis();

    private final Clock clock;

    public ComprehensionScoringService(Clock clock) {
        this.clock = clock;
    }

    public Comprehension calculateConceptComprehension(List<? extends BehaviorSignal> signals) {
        if (signals == null || signals.isEmpty()) {
            return new Comprehension(NEUTRAL_SCORE, 0.0);
        }

        Instant now = clock.instant();
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (BehaviorSignal signal : signals) {
            SignalScore s = scoreSignal(signal);
            double decay = timeDecay(now, signal.timestamp());
            weightedSum += s.score() * s.weight() * decay;
            totalWeight += s.weight() * decay;
        }

        double score = totalWeight > 0 ? weightedSum / totalWeight : NEUTRAL_SCORE;
        double confidence = Math.min(1.0, signals.size() / 10.0);
        return new Comprehension(clampScore(Math.round(score)), clampUnit(confidence));
    }

    public EntanglementState scoreToEntanglementState(double score, double confidence, long cascadeFailures) {
        return EntanglementState.fromScore(score, confidence, cascadeFailures);
    }

    /**
     * Appends the signal to the concept's window, rescoring over the trimmed window. Cascade counters are left
     * as they are. Unknown concepts leave the graph untouched.
     */
    public ConceptEntanglementGraph updateConceptEntanglement(ConceptEntanglementGraph graph, String conceptId,
                                                              BehaviorSignal signal) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(signal, "signal");
        ConceptEntanglement current = graph.entanglements().get(conceptId);
        if (current == null) return graph;

        List<BehaviorSignal> window = new ArrayList<>(current.signals());
        window.add(signal);
        if (window.size() > SIGNAL_WINDOW) {
            window = window.subList(window.size() - SIGNAL_WINDOW, window.size());
        }

        Comprehension c = calculateConceptComprehension(window);
        Instant now = clock.instant();
        ConceptEntanglement next = current.withSignals(window, c.score(), c.confidence(), signalTimeSpent(signal), now);
        return graph.withEntanglement(next, now);
    }

    SignalScore scoreSignal(BehaviorSignal signal) {
        if (signal instanceof QuizSignal q) {
            double accuracy = q.totalQuestions() > 0 ? (double) q.correctAnswers() / q.totalQuestions() : 0.0;
            double attemptPenalty = Math.max(0, q.attemptsUsed() - 1) * 10.0;
            return new SignalScore(clampScore(accuracy * 100 - attemptPenalty), 0.4);
        }
        if (signal instanceof PlaygroundSignal p) {
            if (p.runCount() <= 0) return new SignalScore(NEUTRAL_SCORE, 0.1);
            double successRate = (double) p.successfulRuns() / p.runCount();
            double errorPenalty = (double) p.errorCount() / p.runCount() * 20;
            return new SignalScore(clampScore(successRate * 100 - errorPenalty), 0.3);
        }
        if (signal instanceof SectionTimeSignal st) {
            double revisitPenalty = Math.max(0, st.revisitCount() - 2) * 5.0;
            return new SignalScore(clampScore(st.completionPercentage() - revisitPenalty), 0.15);
        }
        if (signal instanceof ErrorPatternSignal ep) {
            return new SignalScore(clampScore(100 - ep.repeatedCount() * 25.0), 0.1);
        }
        if (signal instanceof VideoSignal v) {
            double rewindPenalty = Math.min(20, Math.max(0, v.rewindCount()) * 4.0);
            return new SignalScore(clampScore(v.watchedPercentage() - rewindPenalty), 0.1);
        }
        if (signal instanceof NavigationSignal n) {
            return new SignalScore(n.backward() ? 50 : 75, 0.05);
        }
        return new SignalScore(NEUTRAL_SCORE, 0.1);
    }

    long signalTimeSpent(BehaviorSignal signal) {
        if (signal instanceof QuizSignal q) return Math.max(0, q.timeSpentMs());
        if (signal instanceof PlaygroundSignal p) return Math.max(0, p.timeSpentMs());
        if (signal instanceof SectionTimeSignal st) return Math.max(0, st.timeSpentMs());
        if (signal instanceof VideoSignal v) {
            return Math.round(clampScore(v.watchedPercentage()) / 100.0 * ASSUMED_VIDEO_MS);
        }
        return 0L;
    }

    // 1.0 for a fresh signal, linear down to 0.3 at seven days, never below.
    double timeDecay(Instant now, Instant signalAt) {
        if (signalAt == null) return 0.3;
        long ageMs = Math.max(0L, now.toEpochMilli() - signalAt.toEpochMilli());
        return Math.max(0.3, 1.0 - ((double) ageMs / DECAY_HORIZON_MS) * 0.7);
    }
}
