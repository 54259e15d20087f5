package com.cellar.readiness.repository;

import com.cellar.readiness.entity.WineEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WineRepository extends JpaRepository<WineEntity, Long> {

    /**
     * All wines after the cursor, in id order
     */
    @Query("SELECT w FROM WineEntity w WHERE w.id > :cursor ORDER BY w.id ASC")
    List<WineEntity> findPageAfter(@Param("cursor") Long cursor, Pageable pageable);

    /**
     * Wines after the cursor that have no readiness result
     */
    @Query("SELECT w FROM WineEntity w WHERE w.id > :cursor " +
           "AND NOT EXISTS (SELECT r FROM WineReadinessEntity r WHERE r.wineId = w.id) " +
           "ORDER BY w.id ASC")
    List<WineEntity> findMissingReadinessAfter(@Param("cursor") Long cursor, Pageable pageable);

    /**
     * Wines after the cursor with no result computed by the given algorithm version
     * (covers both missing and stale rows)
     */
    @Query("SELECT w FROM WineEntity w WHERE w.id > :cursor " +
           "AND NOT EXISTS (SELECT r FROM WineReadinessEntity r " +
           "                WHERE r.wineId = w.id AND r.algorithmVersion = :version) " +
           "ORDER BY w.id ASC")
    List<WineEntity> findStaleOrMissingAfter(@Param("cursor") Long cursor,
                                             @Param("version") int version,
                                             Pageable pageable);

    @Query("SELECT COUNT(w) FROM WineEntity w " +
           "WHERE NOT EXISTS (SELECT r FROM WineReadinessEntity r WHERE r.wineId = w.id)")
    long countMissingReadiness();

    @Query("SELECT COUNT(w) FROM WineEntity w " +
           "WHERE NOT EXISTS (SELECT r FROM WineReadinessEntity r " +
           "                  WHERE r.wineId = w.id AND r.algorithmVersion = :version)")
    long countStaleOrMissing(@Param("version") int version);
}
