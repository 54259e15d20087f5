package com.cellar.readiness.engine;

import com.cellar.readiness.domain.Confidence;

/**
 * Aging potential of a red wine and the age thresholds (in years) that go with it.
 */
public enum AgingBucket {
    HIGH(4, 6, 15, 25, Confidence.HIGH),
    MEDIUM(2, 3, 8, 15, Confidence.MED),
    LOW(1, 2, 5, 8, Confidence.HIGH);

    static final int START_SCORE = 20;
    static final int HOLD_END_SCORE = 65;
    static final int PEAK_SCORE = 90;
    static final int MAX_AGE_SCORE = 70;
    static final double DECLINE_PER_YEAR = 5.0;

    private final int holdYears;
    private final int peakStart;
    private final int peakEnd;
    private final int maxAge;
    private final Confidence certainty;
    private final AgeCurve curve;

    AgingBucket(int holdYears, int peakStart, int peakEnd, int maxAge, Confidence certainty) {
        this.holdYears = holdYears;
        this.peakStart = peakStart;
        this.peakEnd = peakEnd;
        this.maxAge = maxAge;
        this.certainty = certainty;
        this.curve = new AgeCurve(new int[][]{
                {0, START_SCORE},
                {holdYears, HOLD_END_SCORE},
                {peakStart, PEAK_SCORE},
                {peakEnd, PEAK_SCORE},
                {maxAge, MAX_AGE_SCORE}
        }, DECLINE_PER_YEAR);
    }

    public int getHoldYears() {
        return holdYears;
    }

    public int getPeakStart() {
        return peakStart;
    }

    public int getPeakEnd() {
        return peakEnd;
    }

    public int getMaxAge() {
        return maxAge;
    }

    /**
     * How sure the bucket assignment is: the extremes are clear-cut, the middle is not.
     */
    public Confidence getCertainty() {
        return certainty;
    }

    int scoreAt(int age) {
        return curve.scoreAt(age);
    }
}
