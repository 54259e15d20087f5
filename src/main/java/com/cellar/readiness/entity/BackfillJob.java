package com.cellar.readiness.entity;

import com.cellar.readiness.domain.BackfillMode;
import com.cellar.readiness.domain.BackfillStatus;
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
 * Persisted state of a readiness backfill. Everything a step needs to continue lives here.
 */
@Entity
@Table(name = "readiness_backfill_jobs", indexes = {
        @Index(name = "idx_readiness_jobs_status", columnList = "status, created_date")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BackfillJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BackfillMode mode;

    @Column(nullable = false)
    private Integer batchSize;

    @Column(nullable = false)
    private Integer algorithmVersionAtStart;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 12)
    @Builder.Default
    private BackfillStatus status = BackfillStatus.IDLE;

    /** Id of the last wine row of the last committed batch. */
    @Column(name = "cursor_key")
    private Long cursor;

    @Builder.Default
    private int processed = 0;
    @Builder.Default
    private int updated = 0;
    @Builder.Default
    private int skipped = 0;
    @Builder.Default
    private int failed = 0;

    @Type(JsonBinaryType.class)
    @Column(columnDefinition = "jsonb")
    @Builder.Default
    private List<BackfillFailure> failures = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String errorDetails;

    private Long estimatedTotal;

    // Only written by the cancel update query, never by entity saves
    @Column(nullable = false, updatable = false)
    @Builder.Default
    private boolean cancelRequested = false;

    // Step claim, same rule as the cancel flag: only the claim/release queries write it
    @Column(nullable = false, updatable = false)
    @Builder.Default
    private boolean stepping = false;

    @Column(updatable = false)
    private LocalDateTime stepClaimedAt;

    private LocalDateTime createdDate;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;

    @Column(nullable = false)
    private LocalDateTime lastUpdateDate;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        lastUpdateDate = now;
        if (createdDate == null) {
            createdDate = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        lastUpdateDate = LocalDateTime.now();
    }
}
