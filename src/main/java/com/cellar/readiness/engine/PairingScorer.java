package com.cellar.readiness.engine;

import com.cellar.readiness.domain.FoodProfile;
import com.cellar.readiness.domain.PairingScore;
import com.cellar.readiness.domain.StructuralProfile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rates how well a wine's structure suits a dish, 0-100, with a short explanation.
 * Starts from a neutral 50 and adds every rule's signed contribution.
 */
@Component
public class PairingScorer {

    public static final int NEUTRAL_SCORE = 50;
    public static final String NEUTRAL_EXPLANATION = "No strong pairing signals, a neutral match";

    /** A runner-up within this many points of the top rule is mentioned too. */
    static final int RUNNER_UP_MARGIN = 5;

    private final List<PairingRule> rules;

    public PairingScorer() {
        this(PairingRules.defaults());
    }

    public PairingScorer(List<PairingRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public PairingScore score(StructuralProfile profile, FoodProfile food) {
        if (profile == null || food == null) {
            return new PairingScore(NEUTRAL_SCORE, NEUTRAL_EXPLANATION);
        }

        List<PairingContribution> contributions = new ArrayList<>();
        for (PairingRule rule : rules) {
            rule.evaluate(profile, food).ifPresent(contributions::add);
        }

        int total = NEUTRAL_SCORE;
        for (PairingContribution contribution : contributions) {
            total += contribution.getWeight();
        }
        int clamped = Math.max(0, Math.min(100, total));

        return new PairingScore(clamped, explain(contributions));
    }

    private static String explain(List<PairingContribution> contributions) {
        if (contributions.isEmpty()) {
            return NEUTRAL_EXPLANATION;
        }
        // Stable sort keeps rule order for equal magnitudes
        List<PairingContribution> ranked = new ArrayList<>(contributions);
        ranked.sort(Comparator.comparingInt((PairingContribution c) -> Math.abs(c.getWeight())).reversed());

        PairingContribution top = ranked.get(0);
        if (ranked.size() > 1) {
            PairingContribution runnerUp = ranked.get(1);
            if (Math.abs(top.getWeight()) - Math.abs(runnerUp.getWeight()) <= RUNNER_UP_MARGIN) {
                return top.getExplanation() + "; " + runnerUp.getExplanation();
            }
        }
        return top.getExplanation();
    }
}
