package com.cellar.readiness.engine;

import com.cellar.readiness.domain.Confidence;
import com.cellar.readiness.domain.ReadinessResult;
import com.cellar.readiness.domain.ReadinessStatus;
import com.cellar.readiness.domain.StructuralProfile;
import com.cellar.readiness.domain.WineColor;
import com.cellar.readiness.domain.WineRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Classifies drinking readiness from vintage age, wine type and structure.
 * Pure and deterministic: the current year and algorithm version are always passed in.
 */
@Component
public class ReadinessCalculator {

    public static final int MIN_PLAUSIBLE_VINTAGE = 1900;
    public static final int UNKNOWN_SCORE = 50;
    public static final String OUT_OF_RANGE_REASON = "vintage out of plausible range";

    // Structure score weights for red aging potential
    public static final double STRUCTURE_TANNIN_WEIGHT = 1.0;
    public static final double STRUCTURE_ACIDITY_WEIGHT = 0.6;
    public static final double STRUCTURE_OAK_WEIGHT = 0.5;
    public static final double STRUCTURE_POWER_WEIGHT = 0.5;

    public static final double HIGH_POTENTIAL_MIN_STRUCTURE = 10.0;
    public static final double MEDIUM_POTENTIAL_MIN_STRUCTURE = 6.0;

    private final HeuristicProfileEstimator heuristicEstimator;

    @Autowired
    public ReadinessCalculator(HeuristicProfileEstimator heuristicEstimator) {
        this.heuristicEstimator = heuristicEstimator;
    }

    public ReadinessCalculator() {
        this(new HeuristicProfileEstimator());
    }

    public ReadinessResult compute(Integer vintageYear, int currentYear, WineColor color,
                                   StructuralProfile profile, int algorithmVersion) {
        return compute(vintageYear, currentYear, color, List.of(), null, profile, algorithmVersion);
    }

    public ReadinessResult compute(WineRecord wine, int currentYear, StructuralProfile profile, int algorithmVersion) {
        return compute(wine.getVintageYear(), currentYear, wine.getColor(), wine.getGrapes(),
                regionText(wine), profile, algorithmVersion);
    }

    private ReadinessResult compute(Integer vintageYear, int currentYear, WineColor color, List<String> grapes,
                                    String region, StructuralProfile profile, int algorithmVersion) {
        if (vintageYear == null || vintageYear < MIN_PLAUSIBLE_VINTAGE || vintageYear > currentYear) {
            return ReadinessResult.builder()
                    .score(UNKNOWN_SCORE)
                    .status(ReadinessStatus.UNKNOWN)
                    .confidence(Confidence.LOW)
                    .reason(OUT_OF_RANGE_REASON)
                    .algorithmVersion(algorithmVersion)
                    .build();
        }

        int age = currentYear - vintageYear;
        WineColor type = color != null ? color : WineColor.RED;
        FixedTypeBand band = FixedTypeBand.forColor(type);
        if (band != null) {
            return computeFixedBand(band, vintageYear, age, algorithmVersion);
        }
        return computeRed(vintageYear, age, grapes, region, profile, algorithmVersion);
    }

    private ReadinessResult computeFixedBand(FixedTypeBand band, int vintage, int age, int algorithmVersion) {
        ReadinessStatus status;
        String ageReason;
        if (age < band.riseEnd) {
            status = ReadinessStatus.READY_NOW;
            ageReason = String.format("Age %d: fresh and ready (best within %d years)", age, band.riseEnd);
        } else if (age <= band.plateauEnd) {
            status = ReadinessStatus.PEAK;
            ageReason = String.format("Age %d: at peak freshness (%d-%d years)", age, band.riseEnd, band.plateauEnd);
        } else if (age <= band.maxAge) {
            status = ReadinessStatus.IN_WINDOW;
            ageReason = String.format("Age %d: still drinking well, drink soon (up to %d years)", age, band.maxAge);
        } else {
            status = ReadinessStatus.PAST_PEAK;
            ageReason = String.format("Age %d: beyond %d years, may have lost freshness", age, band.maxAge);
        }

        return ReadinessResult.builder()
                .score(band.scoreAt(age))
                .status(status)
                .drinkWindowStart(vintage)
                .drinkWindowEnd(vintage + band.maxAge)
                .confidence(band.confidence)
                .reason(band.typeNote)
                .reason(ageReason)
                .algorithmVersion(algorithmVersion)
                .build();
    }

    private ReadinessResult computeRed(int vintage, int age, List<String> grapes, String region,
                                       StructuralProfile profile, int algorithmVersion) {
        List<String> reasons = new ArrayList<>();
        heuristicEstimator.describeTypicity(grapes).ifPresent(reasons::add);

        boolean estimated = profile == null;
        StructuralProfile effective = estimated
                ? heuristicEstimator.estimate(grapes, region, WineColor.RED)
                : profile;

        double structure = structureScore(effective);
        AgingBucket bucket = bucketFor(structure);
        reasons.add(String.format(Locale.ROOT,
                "Structure score %.1f (tannin %d, acidity %d, oak %d, power %d): %s aging potential",
                structure, effective.getTannin(), effective.getAcidity(), effective.getOak(),
                effective.getPower(), bucket.name().toLowerCase(Locale.ROOT)));

        Confidence confidence;
        if (estimated) {
            confidence = Confidence.LOW;
            reasons.add("No wine profile available, estimated from grape and region");
        } else {
            confidence = effective.getConfidence().min(bucket.getCertainty());
        }

        ReadinessStatus status;
        if (age < bucket.getHoldYears()) {
            status = ReadinessStatus.TOO_YOUNG;
            reasons.add(String.format("Age %d: still developing, hold until %d years", age, bucket.getHoldYears()));
        } else if (age < bucket.getPeakStart()) {
            status = ReadinessStatus.APPROACHING;
            reasons.add(String.format("Age %d: approaching peak window (%d-%d years)",
                    age, bucket.getPeakStart(), bucket.getPeakEnd()));
        } else if (age <= bucket.getPeakEnd()) {
            status = ReadinessStatus.PEAK;
            reasons.add(String.format("Age %d: inside peak window (%d-%d years)",
                    age, bucket.getPeakStart(), bucket.getPeakEnd()));
        } else if (age <= bucket.getMaxAge()) {
            status = ReadinessStatus.IN_WINDOW;
            reasons.add(String.format("Age %d: past peak window but within %d years", age, bucket.getMaxAge()));
        } else {
            status = ReadinessStatus.PAST_PEAK;
            reasons.add(String.format("Age %d: beyond %d years, may be past prime", age, bucket.getMaxAge()));
        }

        return ReadinessResult.builder()
                .score(bucket.scoreAt(age))
                .status(status)
                .drinkWindowStart(vintage + bucket.getHoldYears())
                .drinkWindowEnd(vintage + bucket.getMaxAge())
                .confidence(confidence)
                .reasons(reasons)
                .algorithmVersion(algorithmVersion)
                .build();
    }

    public static double structureScore(StructuralProfile profile) {
        return profile.getTannin() * STRUCTURE_TANNIN_WEIGHT
                + profile.getAcidity() * STRUCTURE_ACIDITY_WEIGHT
                + profile.getOak() * STRUCTURE_OAK_WEIGHT
                + profile.getPower() * STRUCTURE_POWER_WEIGHT;
    }

    public static AgingBucket bucketFor(double structureScore) {
        if (structureScore >= HIGH_POTENTIAL_MIN_STRUCTURE) {
            return AgingBucket.HIGH;
        }
        if (structureScore >= MEDIUM_POTENTIAL_MIN_STRUCTURE) {
            return AgingBucket.MEDIUM;
        }
        return AgingBucket.LOW;
    }

    public static String regionText(WineRecord wine) {
        String region = wine.getRegion() != null ? wine.getRegion() : "";
        String appellation = wine.getAppellation() != null ? wine.getAppellation() : "";
        String combined = (region + " " + appellation).trim();
        return combined.isEmpty() ? null : combined;
    }
}
