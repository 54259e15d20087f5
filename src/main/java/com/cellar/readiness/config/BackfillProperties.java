package com.cellar.readiness.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "cellar.backfill")
public class BackfillProperties {
    private int batchSize = 200;
    private int maxBatchSize = 1000;
    private int workerPoolSize = 5;
    private int maxRecordedFailures = 50;
    private String lockName = "readiness-backfill";
    /** A step claim older than this is taken to belong to a crashed process. */
    private long stepClaimTimeoutMs = 600000;
    private boolean schedulerEnabled = false;
    private long schedulerDelayMs = 30000;
}
