package com.cellar.readiness.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Numeric description of a wine's structure.
 * Base axes are 0-5; power (0-10) is always derived from them.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StructuralProfile {

    public static final int AXIS_MIN = 0;
    public static final int AXIS_MAX = 5;
    public static final int POWER_MAX = 10;

    // Power weights: body dominates, sweetness barely moves it
    public static final double POWER_BODY_WEIGHT = 2.0;
    public static final double POWER_TANNIN_WEIGHT = 1.5;
    public static final double POWER_OAK_WEIGHT = 1.0;
    public static final double POWER_ACIDITY_WEIGHT = 0.8;
    public static final double POWER_SWEETNESS_WEIGHT = 0.2;
    public static final double POWER_DIVISOR = 2.0;

    int body;
    int tannin;
    int acidity;
    int oak;
    int sweetness;
    int power;
    Confidence confidence;
    ProfileOrigin source;

    public static StructuralProfile of(int body, int tannin, int acidity, int oak, int sweetness,
                                       Confidence confidence, ProfileOrigin source) {
        int b = clampAxis(body);
        int t = clampAxis(tannin);
        int a = clampAxis(acidity);
        int o = clampAxis(oak);
        int s = clampAxis(sweetness);
        return new StructuralProfile(b, t, a, o, s, computePower(b, t, a, o, s),
                confidence != null ? confidence : Confidence.LOW,
                source != null ? source : ProfileOrigin.HEURISTIC);
    }

    /**
     * Same axes, different confidence. Power is carried over since the axes do not change.
     */
    public StructuralProfile withConfidence(Confidence newConfidence) {
        return of(body, tannin, acidity, oak, sweetness, newConfidence, source);
    }

    public static int computePower(int body, int tannin, int acidity, int oak, int sweetness) {
        double base = body * POWER_BODY_WEIGHT
                + tannin * POWER_TANNIN_WEIGHT
                + oak * POWER_OAK_WEIGHT
                + acidity * POWER_ACIDITY_WEIGHT
                + sweetness * POWER_SWEETNESS_WEIGHT;
        double power = Math.max(0, Math.min(POWER_MAX, base / POWER_DIVISOR));
        return (int) Math.round(power);
    }

    private static int clampAxis(int value) {
        return Math.max(AXIS_MIN, Math.min(AXIS_MAX, value));
    }
}
