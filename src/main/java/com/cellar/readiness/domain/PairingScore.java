package com.cellar.readiness.domain;

import lombok.Value;

@Value
public class PairingScore {
    int score;
    String explanation;
}
