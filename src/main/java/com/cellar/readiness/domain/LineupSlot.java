package com.cellar.readiness.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LineupSlot {
    int position;
    String label;
    LineupCandidate bottle;
    int pairingScore;
    String explanation;
}
