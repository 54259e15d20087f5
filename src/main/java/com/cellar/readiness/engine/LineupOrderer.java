package com.cellar.readiness.engine;

import com.cellar.readiness.config.LineupProperties;
import com.cellar.readiness.domain.FoodProfile;
import com.cellar.readiness.domain.LineupCandidate;
import com.cellar.readiness.domain.LineupPlan;
import com.cellar.readiness.domain.LineupSlot;
import com.cellar.readiness.domain.PairingScore;
import com.cellar.readiness.domain.ReadinessStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks bottles for a tasting and orders them from light to bold.
 */
@Component
@RequiredArgsConstructor
public class LineupOrderer {

    public static final int MIN_BOTTLES = 2;
    public static final int MAX_BOTTLES = 6;

    static final List<String> COURSE_LABELS = List.of(
            "Warm-up", "Mid", "Main", "Finale", "Grand Finale", "Closer");

    private static final Comparator<Scored> RANKING = Comparator
            .comparingInt((Scored s) -> s.pairing.getScore()).reversed()
            .thenComparing(Comparator.comparingDouble((Scored s) -> s.candidate.ratingOrZero()).reversed())
            .thenComparing(Comparator.comparingInt((Scored s) -> s.candidate.readinessScoreOrZero()).reversed())
            .thenComparing(s -> s.candidate.getBottleId(), Comparator.nullsLast(Comparator.<Long>naturalOrder()));

    private static final Comparator<Scored> LIGHT_TO_BOLD = Comparator
            .comparingInt((Scored s) -> s.candidate.powerOrZero())
            .thenComparing(Comparator.comparingDouble((Scored s) -> s.candidate.ratingOrZero()).reversed())
            .thenComparing(s -> s.candidate.getBottleId(), Comparator.nullsLast(Comparator.<Long>naturalOrder()));

    private final PairingScorer pairingScorer;
    private final LineupProperties properties;

    /**
     * One bottle per two guests, never fewer than 2 or more than 6.
     */
    public static int targetCount(int seatCount) {
        int perTwoGuests = (Math.max(seatCount, 0) + 1) / 2;
        return Math.max(MIN_BOTTLES, Math.min(MAX_BOTTLES, perTwoGuests));
    }

    public LineupPlan order(List<LineupCandidate> candidatePool, FoodProfile food, int seatCount) {
        int target = targetCount(seatCount);
        FoodProfile dish = food != null ? food : FoodProfile.neutral();

        List<Scored> ranked = new ArrayList<>();
        if (candidatePool != null) {
            for (LineupCandidate candidate : candidatePool) {
                if (isEligible(candidate)) {
                    ranked.add(new Scored(candidate, pairingScorer.score(candidate.getProfile(), dish)));
                }
            }
        }
        ranked.sort(RANKING);

        List<Scored> selected = new ArrayList<>();
        Set<Long> selectedWines = new HashSet<>();
        List<Scored> reserve = new ArrayList<>();
        Set<Long> seenWines = new HashSet<>();
        for (Scored scored : ranked) {
            Long wineId = scored.candidate.getWineId();
            if (selected.size() < target && selectedWines.add(wineId)) {
                seenWines.add(wineId);
                selected.add(scored);
            } else if (seenWines.add(wineId)) {
                // best bottle of each wine not picked yet
                reserve.add(scored);
            }
        }

        selected.sort(LIGHT_TO_BOLD);
        smoothTransitions(selected, reserve);

        int largestStep = largestStep(selected);
        List<LineupSlot> slots = new ArrayList<>();
        for (int i = 0; i < selected.size(); i++) {
            Scored scored = selected.get(i);
            slots.add(LineupSlot.builder()
                    .position(i + 1)
                    .label(i < COURSE_LABELS.size() ? COURSE_LABELS.get(i) : "Wine " + (i + 1))
                    .bottle(scored.candidate)
                    .pairingScore(scored.pairing.getScore())
                    .explanation(scored.pairing.getExplanation())
                    .build());
        }

        return LineupPlan.builder()
                .slots(slots)
                .targetCount(target)
                .largestPowerStep(largestStep)
                .bestEffort(largestStep > properties.getJarringThreshold())
                .build();
    }

    private boolean isEligible(LineupCandidate candidate) {
        if (candidate == null || !candidate.isInStock()) {
            return false;
        }
        if (candidate.getRating() == null) {
            if (properties.getMinRating() > 0) {
                return false;
            }
        } else if (candidate.getRating() < properties.getMinRating()) {
            return false;
        }
        return !properties.isExcludeTooYoung()
                || candidate.getReadiness() == null
                || candidate.getReadiness().getStatus() != ReadinessStatus.TOO_YOUNG;
    }

    /**
     * Swaps the weakest pick for a reserve bottle that sits inside a jarring gap,
     * as long as that lowers the largest step. Leaves the list sorted light to bold.
     */
    private void smoothTransitions(List<Scored> selected, List<Scored> reserve) {
        int threshold = properties.getJarringThreshold();
        int attempts = selected.size();
        while (attempts-- > 0 && selected.size() >= 2) {
            int gapIndex = largestStepIndex(selected);
            int currentLargest = step(selected, gapIndex);
            if (currentLargest <= threshold) {
                return;
            }
            int low = selected.get(gapIndex).candidate.powerOrZero();
            int high = selected.get(gapIndex + 1).candidate.powerOrZero();

            Scored weakest = selected.stream().max(RANKING).orElseThrow();
            boolean swapped = false;
            for (Scored bridge : reserve) {
                int power = bridge.candidate.powerOrZero();
                if (power <= low || power >= high) {
                    continue;
                }
                List<Scored> trial = new ArrayList<>(selected);
                trial.remove(weakest);
                trial.add(bridge);
                trial.sort(LIGHT_TO_BOLD);
                if (largestStep(trial) < currentLargest) {
                    selected.clear();
                    selected.addAll(trial);
                    reserve.remove(bridge);
                    swapped = true;
                    break;
                }
            }
            if (!swapped) {
                return;
            }
        }
    }

    private static int largestStepIndex(List<Scored> sequence) {
        int index = 0;
        int largest = -1;
        for (int i = 0; i + 1 < sequence.size(); i++) {
            int step = step(sequence, i);
            if (step > largest) {
                largest = step;
                index = i;
            }
        }
        return index;
    }

    private static int largestStep(List<Scored> sequence) {
        if (sequence.size() < 2) {
            return 0;
        }
        return step(sequence, largestStepIndex(sequence));
    }

    private static int step(List<Scored> sequence, int index) {
        return sequence.get(index + 1).candidate.powerOrZero() - sequence.get(index).candidate.powerOrZero();
    }

    private static final class Scored {
        private final LineupCandidate candidate;
        private final PairingScore pairing;

        private Scored(LineupCandidate candidate, PairingScore pairing) {
            this.candidate = candidate;
            this.pairing = pairing;
        }
    }
}
