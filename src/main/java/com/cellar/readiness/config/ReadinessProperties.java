package com.cellar.readiness.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "cellar.readiness")
public class ReadinessProperties {
    /**
     * Version stamped on every computed result. Bump it whenever the readiness
     * rules change so stale_or_missing backfills pick the old rows up again.
     */
    private int algorithmVersion = 2;
}
