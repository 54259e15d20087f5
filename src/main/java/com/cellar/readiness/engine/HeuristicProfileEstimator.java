package com.cellar.readiness.engine;

import com.cellar.readiness.domain.Confidence;
import com.cellar.readiness.domain.ProfileOrigin;
import com.cellar.readiness.domain.StructuralProfile;
import com.cellar.readiness.domain.WineColor;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Coarse structural profile from grape, region and color when no AI profile exists.
 * Never fails: unmatched input yields the neutral profile.
 */
@Component
public class HeuristicProfileEstimator {

    public static final int NEUTRAL_AXIS = 2;

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-_]+");

    private final List<GrapeProfileRule> grapeRules;
    private final List<RegionAdjustment> regionAdjustments;

    public HeuristicProfileEstimator() {
        this(HeuristicProfileTables.GRAPES, HeuristicProfileTables.REGIONS);
    }

    public HeuristicProfileEstimator(List<GrapeProfileRule> grapeRules, List<RegionAdjustment> regionAdjustments) {
        this.grapeRules = List.copyOf(grapeRules);
        this.regionAdjustments = List.copyOf(regionAdjustments);
    }

    public StructuralProfile estimate(List<String> grapes, String region, WineColor color) {
        Optional<GrapeProfileRule> grapeRule = findGrapeRule(grapes);
        String normalizedRegion = normalize(region);
        Optional<RegionAdjustment> regionAdjustment = regionAdjustments.stream()
                .filter(adjustment -> !normalizedRegion.isEmpty() && adjustment.matches(normalizedRegion))
                .findFirst();

        if (grapeRule.isEmpty() && regionAdjustment.isEmpty()) {
            return neutral();
        }

        // body, tannin, acidity, oak, sweetness
        int[] axes = baseline(color);
        grapeRule.ifPresent(rule -> rule.applyTo(axes));
        regionAdjustment.ifPresent(adjustment -> adjustment.applyTo(axes));

        return StructuralProfile.of(axes[0], axes[1], axes[2], axes[3], axes[4],
                Confidence.LOW, ProfileOrigin.HEURISTIC);
    }

    /**
     * Aging note of the primary grape, if it is in the table.
     */
    public Optional<String> describeTypicity(List<String> grapes) {
        return findGrapeRule(grapes).map(GrapeProfileRule::getAgingNote);
    }

    public StructuralProfile neutral() {
        return StructuralProfile.of(NEUTRAL_AXIS, NEUTRAL_AXIS, NEUTRAL_AXIS, NEUTRAL_AXIS, NEUTRAL_AXIS,
                Confidence.LOW, ProfileOrigin.HEURISTIC);
    }

    private Optional<GrapeProfileRule> findGrapeRule(List<String> grapes) {
        if (grapes == null) {
            return Optional.empty();
        }
        for (String grape : grapes) {
            String normalized = normalize(grape);
            if (normalized.isEmpty()) {
                continue;
            }
            for (GrapeProfileRule rule : grapeRules) {
                if (rule.matches(normalized)) {
                    return Optional.of(rule);
                }
            }
        }
        return Optional.empty();
    }

    private static int[] baseline(WineColor color) {
        if (color == null) {
            color = WineColor.RED;
        }
        switch (color) {
            case WHITE:
                return new int[]{2, 1, 4, 1, 0};
            case ROSE:
                return new int[]{2, 2, 4, 1, 0};
            case SPARKLING:
                return new int[]{2, 1, 5, 1, 1};
            case RED:
            default:
                return new int[]{3, 3, 3, 2, 0};
        }
    }

    static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String stripped = DIACRITICS.matcher(Normalizer.normalize(raw, Normalizer.Form.NFD)).replaceAll("");
        return SEPARATORS.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }
}
