package com.cellar.readiness.domain;

import lombok.Builder;
import lombok.Value;

/**
 * An in-stock bottle and the wine it holds.
 */
@Value
@Builder
public class BottleRecord {
    Long bottleId;
    int quantity;
    Double rating;
    WineRecord wine;
}
