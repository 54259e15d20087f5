package com.cellar.readiness.engine;

import lombok.Value;

/**
 * Signed points one pairing rule adds to the running total, with the sentence that explains them.
 */
@Value
public class PairingContribution {
    String rule;
    int weight;
    String explanation;
}
