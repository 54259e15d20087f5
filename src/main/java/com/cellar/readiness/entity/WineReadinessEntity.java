package com.cellar.readiness.entity;

import com.cellar.readiness.domain.Confidence;
import com.cellar.readiness.domain.ReadinessStatus;
import io.hypersistence.utils.hibernate.type.json.JsonBinaryType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Type;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Latest readiness result per wine, overwritten on every recomputation.
 */
@Entity
@Table(name = "wine_readiness", indexes = {
        @Index(name = "idx_wine_readiness_version", columnList = "algorithm_version, wine_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WineReadinessEntity {

    @Id
    @Column(name = "wine_id")
    private Long wineId;

    @Column(nullable = false)
    private Integer readinessScore;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReadinessStatus readinessStatus;

    private Integer drinkWindowStart;
    private Integer drinkWindowEnd;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Confidence confidence;

    @Type(JsonBinaryType.class)
    @Column(columnDefinition = "jsonb")
    @Builder.Default
    private List<String> reasons = new ArrayList<>();

    @Column(name = "algorithm_version", nullable = false)
    private Integer algorithmVersion;

    @Column(nullable = false)
    private LocalDateTime computedAt;
}
