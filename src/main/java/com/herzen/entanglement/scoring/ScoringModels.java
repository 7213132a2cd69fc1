package com.herzen.entanglement.scoring;

public class ScoringModels {
    public record Comprehension(double score, double confidence) {}

    public record SignalScore(double score, double weight) {}
}
