package com.yescount.planner.domain.model;

/**
 * Weights of the three recommendation signals.
 */
public record ScoringWeights(double interest, double overlap, double admin) {

    public static final ScoringWeights DEFAULT = new ScoringWeights(0.4, 0.4, 0.2);
}
