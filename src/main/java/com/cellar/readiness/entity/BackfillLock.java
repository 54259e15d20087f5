package com.cellar.readiness.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Single-writer lock row. A job may run only while it holds the row; acquiring and
 * releasing are conditional updates, so two concurrent starts cannot both win.
 */
@Entity
@Table(name = "backfill_locks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillLock {

    @Id
    @Column(length = 64)
    private String name;

    @Column(nullable = false)
    @Builder.Default
    private boolean locked = false;

    private Long holderJobId;

    private LocalDateTime acquiredAt;
}
