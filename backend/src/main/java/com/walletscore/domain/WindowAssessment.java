package com.walletscore.domain;

/**
 * Features of one window together with their score.
 */
public record WindowAssessment(FeatureSnapshot features, ScoreResult score) {
}
