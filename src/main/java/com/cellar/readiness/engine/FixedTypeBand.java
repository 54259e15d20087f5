package com.cellar.readiness.engine;

import com.cellar.readiness.domain.Confidence;
import com.cellar.readiness.domain.WineColor;

/**
 * Type-specific age bands for wines drunk on freshness rather than structure.
 * Rising until {@code riseEnd}, plateau until {@code plateauEnd}, declining until {@code maxAge}.
 */
enum FixedTypeBand {
    SPARKLING(3, 5, 8, 80, 85, 65, Confidence.HIGH, "Sparkling wines are best enjoyed young and fresh"),
    WHITE(2, 5, 8, 75, 85, 60, Confidence.MED, "White wines are typically ready soon after release"),
    ROSE(1, 3, 5, 80, 85, 55, Confidence.MED, "Rose is made for early drinking");

    private static final double DECLINE_PER_YEAR = 5.0;

    final int riseEnd;
    final int plateauEnd;
    final int maxAge;
    final Confidence confidence;
    final String typeNote;
    private final AgeCurve curve;

    FixedTypeBand(int riseEnd, int plateauEnd, int maxAge, int startScore, int peakScore, int lateScore,
                  Confidence confidence, String typeNote) {
        this.riseEnd = riseEnd;
        this.plateauEnd = plateauEnd;
        this.maxAge = maxAge;
        this.confidence = confidence;
        this.typeNote = typeNote;
        this.curve = new AgeCurve(new int[][]{
                {0, startScore},
                {riseEnd, peakScore},
                {plateauEnd, peakScore},
                {maxAge, lateScore}
        }, DECLINE_PER_YEAR);
    }

    int scoreAt(int age) {
        return curve.scoreAt(age);
    }

    static FixedTypeBand forColor(WineColor color) {
        switch (color) {
            case SPARKLING:
                return SPARKLING;
            case WHITE:
                return WHITE;
            case ROSE:
                return ROSE;
            default:
                return null;
        }
    }
}
