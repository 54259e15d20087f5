package com.cellar.readiness.engine;

/**
 * Piecewise-linear score over wine age. Knots must be given in ascending age order;
 * past the last knot the score keeps falling by {@code tailSlope} points per year.
 */
final class AgeCurve {

    private final int[] ages;
    private final int[] scores;
    private final double tailSlope;

    AgeCurve(int[][] knots, double tailSlope) {
        this.ages = new int[knots.length];
        this.scores = new int[knots.length];
        for (int i = 0; i < knots.length; i++) {
            ages[i] = knots[i][0];
            scores[i] = knots[i][1];
        }
        this.tailSlope = tailSlope;
    }

    int scoreAt(int age) {
        double value;
        int last = ages.length - 1;
        if (age <= ages[0]) {
            value = scores[0];
        } else if (age >= ages[last]) {
            value = scores[last] - tailSlope * (age - ages[last]);
        } else {
            value = scores[last];
            for (int i = 0; i < last; i++) {
                if (age >= ages[i] && age <= ages[i + 1]) {
                    int span = ages[i + 1] - ages[i];
                    double fraction = span == 0 ? 1.0 : (double) (age - ages[i]) / span;
                    value = scores[i] + fraction * (scores[i + 1] - scores[i]);
                    break;
                }
            }
        }
        return (int) Math.max(0, Math.min(100, Math.round(value)));
    }
}
