package com.cellar.readiness.engine;

import com.cellar.readiness.domain.FoodProfile;
import com.cellar.readiness.domain.StructuralProfile;

import java.util.Optional;

/**
 * One wine and food pairing heuristic. Returns empty when the dish does not trigger the rule.
 */
public interface PairingRule {

    String name();

    Optional<PairingContribution> evaluate(StructuralProfile wine, FoodProfile food);
}
