package com.cellar.readiness.domain;

import lombok.Value;

/**
 * Row filter for a backfill page: the mode plus the version that counts as fresh.
 */
@Value
public class BackfillFilter {
    BackfillMode mode;
    int algorithmVersion;
}
