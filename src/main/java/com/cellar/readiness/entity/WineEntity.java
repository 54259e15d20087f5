package com.cellar.readiness.entity;

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
 * Wine row. Created and edited by the inventory CRUD; this service only reads it,
 * apart from storing the AI-generated structural profile.
 */
@Entity
@Table(name = "wines")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WineEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String wineName;

    private String producer;
    private Integer vintage;
    private String color; // red, white, rose, sparkling

    @Type(JsonBinaryType.class)
    @Column(columnDefinition = "jsonb")
    @Builder.Default
    private List<String> grapes = new ArrayList<>();

    private String region;
    private String appellation;
    private String country;

    private Double rating; // 0-5

    /**
     * AI structural profile as JSON: {body, tannin, acidity, oak, sweetness, confidence, ...}
     */
    @Type(JsonBinaryType.class)
    @Column(name = "wine_profile", columnDefinition = "jsonb")
    private String wineProfileJson;

    private LocalDateTime wineProfileUpdatedAt;

    private LocalDateTime createdDate;

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
