package com.herzen.entanglement.signal;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

public class BehaviorSignals {

    /**
     * Timestamped learner behaviour observation. Variants are immutable and consumed as-is.
     */
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = QuizSignal.class, name = SignalTypes.QUIZ),
            @JsonSubTypes.Type(value = PlaygroundSignal.class, name = SignalTypes.PLAYGROUND),
            @JsonSubTypes.Type(value = SectionTimeSignal.class, name = SignalTypes.SECTION_TIME),
            @JsonSubTypes.Type(value = ErrorPatternSignal.class, name = SignalTypes.ERROR_PATTERN),
            @JsonSubTypes.Type(value = VideoSignal.class, name = SignalTypes.VIDEO),
            @JsonSubTypes.Type(value = NavigationSignal.class, name = SignalTypes.NAVIGATION)
    })
    public interface BehaviorSignal {
        Instant timestamp();
    }

    public record QuizSignal(Instant timestamp, int correctAnswers, int totalQuestions, int attemptsUsed,
                             long timeSpentMs) implements BehaviorSignal {}

    public record PlaygroundSignal(Instant timestamp, int runCount, int successfulRuns, int errorCount,
                                   int modificationsCount, long timeSpentMs) implements BehaviorSignal {}

    public record SectionTimeSignal(Instant timestamp, double completionPercentage, int revisitCount,
                                    long timeSpentMs) implements BehaviorSignal {}

    public record ErrorPatternSignal(Instant timestamp, int repeatedCount) implements BehaviorSignal {}

    public record VideoSignal(Instant timestamp, double watchedPercentage, int rewindCount) implements BehaviorSignal {}

    public record NavigationSignal(Instant timestamp, boolean backward) implements BehaviorSignal {}
}
