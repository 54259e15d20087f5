package com.cellar.readiness.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StructuralProfileTest {

    @Test
    void testPowerIsDerivedFromAxes() {
        // (4*2 + 3*1.5 + 2*1 + 3*0.8 + 0*0.2) / 2 = 8.45
        StructuralProfile profile = StructuralProfile.of(4, 3, 3, 2, 0, Confidence.MED, ProfileOrigin.AI);

        assertEquals(8, profile.getPower());
    }

    @Test
    void testPowerIsClampedToTen() {
        StructuralProfile profile = StructuralProfile.of(5, 5, 5, 5, 5, Confidence.HIGH, ProfileOrigin.AI);

        assertEquals(10, profile.getPower());
    }

    @Test
    void testAxesAreClamped() {
        StructuralProfile profile = StructuralProfile.of(9, -3, 5, 6, 0, null, null);

        assertEquals(5, profile.getBody());
        assertEquals(0, profile.getTannin());
        assertEquals(5, profile.getOak());
        assertEquals(Confidence.LOW, profile.getConfidence());
        assertEquals(ProfileOrigin.HEURISTIC, profile.getSource());
        assertEquals(StructuralProfile.computePower(5, 0, 5, 5, 0), profile.getPower());
    }

    @Test
    void testWithConfidenceKeepsAxesAndPower() {
        StructuralProfile profile = StructuralProfile.of(3, 2, 4, 1, 1, Confidence.HIGH, ProfileOrigin.AI);
        StructuralProfile lowered = profile.withConfidence(Confidence.LOW);

        assertEquals(Confidence.LOW, lowered.getConfidence());
        assertEquals(profile.getPower(), lowered.getPower());
        assertEquals(profile.getAcidity(), lowered.getAcidity());
    }

    @Test
    void testConfidenceMin() {
        assertEquals(Confidence.MED, Confidence.HIGH.min(Confidence.MED));
        assertEquals(Confidence.LOW, Confidence.LOW.min(Confidence.HIGH));
        assertEquals(Confidence.MED, Confidence.fromString("medium"));
    }

    @Test
    void testWineColorIsLenient() {
        assertEquals(WineColor.ROSE, WineColor.fromString("Rosé"));
        assertEquals(WineColor.SPARKLING, WineColor.fromString("Sparkling White"));
        assertEquals(WineColor.WHITE, WineColor.fromString("WHITE"));
        assertEquals(WineColor.RED, WineColor.fromString(null));
    }

    @Test
    void testBackfillModeParsing() {
        assertEquals(BackfillMode.FORCE_ALL, BackfillMode.fromString("force_all"));
        assertEquals(BackfillMode.STALE_OR_MISSING, BackfillMode.fromString("STALE_OR_MISSING"));
        assertEquals(BackfillMode.MISSING_ONLY, BackfillMode.fromString(null));
        assertThrows(IllegalArgumentException.class, () -> BackfillMode.fromString("everything"));
    }
}
