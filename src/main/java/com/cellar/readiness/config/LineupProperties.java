package com.cellar.readiness.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "cellar.lineup")
public class LineupProperties {
    /** Bottles rated below this (0-5 scale) are not considered. 0 admits unrated bottles. */
    private double minRating = 3.5;
    /** Largest acceptable power step between two consecutive wines. */
    private int jarringThreshold = 3;
    private boolean excludeTooYoung = true;
}
