package com.cellar.readiness.engine;

import com.cellar.readiness.domain.Confidence;
import com.cellar.readiness.domain.FoodProfile;
import com.cellar.readiness.domain.FoodProfile.Level;
import com.cellar.readiness.domain.FoodProfile.Protein;
import com.cellar.readiness.domain.FoodProfile.Sauce;
import com.cellar.readiness.domain.PairingScore;
import com.cellar.readiness.domain.ProfileOrigin;
import com.cellar.readiness.domain.StructuralProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PairingScorerTest {

    private PairingScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new PairingScorer();
    }

    @Test
    void testTannicRedWithRichBeefScoresHigh() {
        StructuralProfile profile = profile(5, 5, 4, 3, 0);
        FoodProfile steak = FoodProfile.builder().protein(Protein.BEEF).sauce(Sauce.RICH).build();

        PairingScore score = scorer.score(profile, steak);

        // 50 + 30 for tannin+acidity 9, + 5 for full body with red meat
        assertEquals(85, score.getScore());
        assertTrue(score.getExplanation().contains("tannin"));
        assertTrue(score.getExplanation().contains("beef"));
    }

    @Test
    void testNeutralFoodScoresFifty() {
        PairingScore empty = scorer.score(profile(5, 5, 5, 5, 0), FoodProfile.neutral());
        PairingScore none = scorer.score(profile(1, 1, 1, 1, 0),
                FoodProfile.builder().protein(Protein.NONE).sauce(Sauce.NONE).spiceLevel(Level.LOW).build());

        assertEquals(PairingScorer.NEUTRAL_SCORE, empty.getScore());
        assertEquals(PairingScorer.NEUTRAL_EXPLANATION, empty.getExplanation());
        assertEquals(PairingScorer.NEUTRAL_SCORE, none.getScore());
    }

    @Test
    void testMissingInputsAreNeutral() {
        assertEquals(PairingScorer.NEUTRAL_SCORE, scorer.score(null, FoodProfile.neutral()).getScore());
        assertEquals(PairingScorer.NEUTRAL_SCORE, scorer.score(profile(3, 3, 3, 3, 0), null).getScore());
    }

    @Test
    void testSoftWineWithRichDishIsPenalized() {
        PairingScore score = scorer.score(profile(2, 1, 2, 1, 0),
                FoodProfile.builder().sauce(Sauce.CREAM).build());

        assertEquals(30, score.getScore());
        assertEquals("Too soft in tannin and acidity for a rich dish", score.getExplanation());
    }

    @Test
    void testTomatoNeedsAcidity() {
        FoodProfile pasta = FoodProfile.builder().sauce(Sauce.TOMATO).build();

        assertEquals(70, scorer.score(profile(3, 3, 4, 2, 0), pasta).getScore());
        assertEquals(35, scorer.score(profile(3, 3, 2, 2, 0), pasta).getScore());
    }

    @Test
    void testSweetnessTamesHeat() {
        // Riesling-like: soft tannin, power 5, off-dry
        PairingScore score = scorer.score(profile(2, 1, 5, 1, 2),
                FoodProfile.builder().spiceLevel(Level.HIGH).build());

        assertEquals(65, score.getScore());
        assertEquals("A touch of sweetness tames the heat", score.getExplanation());
    }

    @Test
    void testTanninClashesWithFish() {
        PairingScore score = scorer.score(profile(4, 4, 2, 3, 0),
                FoodProfile.builder().protein(Protein.FISH).build());

        assertEquals(30, score.getScore());
        assertEquals("Tannin clashes with fish", score.getExplanation());
    }

    @Test
    void testCloseRunnerUpIsMentioned() {
        // fat rule 18 + 5, acid rule 20: within five points of each other
        PairingScore score = scorer.score(profile(4, 3, 4, 2, 0),
                FoodProfile.builder().protein(Protein.LAMB).sauce(Sauce.TOMATO).build());

        assertEquals(93, score.getScore());
        assertEquals("Fresh acidity cuts through the richness; Bright acidity matches the tomato",
                score.getExplanation());
    }

    @Test
    void testScoreIsClamped() {
        PairingRule harsh = new PairingRule() {
            @Override
            public String name() {
                return "harsh";
            }

            @Override
            public Optional<PairingContribution> evaluate(StructuralProfile wine, FoodProfile food) {
                return Optional.of(new PairingContribution(name(), -80, "Never works"));
            }
        };
        PairingScorer custom = new PairingScorer(List.of(harsh));

        PairingScore score = custom.score(profile(3, 3, 3, 3, 0), FoodProfile.neutral());

        assertEquals(0, score.getScore());
        assertEquals("Never works", score.getExplanation());
    }

    @Test
    void testScoringIsDeterministic() {
        StructuralProfile profile = profile(4, 4, 3, 4, 0);
        FoodProfile bbq = FoodProfile.builder()
                .protein(Protein.PORK).sauce(Sauce.BBQ).smokeLevel(Level.HIGH).spiceLevel(Level.HIGH).build();

        PairingScore first = scorer.score(profile, bbq);
        PairingScore second = scorer.score(profile, bbq);

        assertEquals(first, second);
    }

    private static StructuralProfile profile(int body, int tannin, int acidity, int oak, int sweetness) {
        return StructuralProfile.of(body, tannin, acidity, oak, sweetness, Confidence.MED, ProfileOrigin.AI);
    }
}
