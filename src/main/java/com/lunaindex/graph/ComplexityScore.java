package com.lunaindex.graph;

public record ComplexityScore(
        String file,
        int coupling,
        int impact,
        int volatility,
        int totalScore,
        Recommendation recommendation) {

    public enum Recommendation {
        OK,
        CONSIDER_REFACTOR,
        REFACTOR
    }
}
