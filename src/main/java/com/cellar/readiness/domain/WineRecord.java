package com.cellar.readiness.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Read-only view of a wine row, the only input the readiness core reads.
 */
@Value
@Builder
public class WineRecord {
    Long id;
    String wineName;
    String producer;
    Integer vintageYear;
    WineColor color;
    @Singular
    List<String> grapes;
    String region;
    String appellation;
}
