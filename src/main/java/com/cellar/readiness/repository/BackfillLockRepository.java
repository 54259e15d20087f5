package com.cellar.readiness.repository;

import com.cellar.readiness.entity.BackfillLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface BackfillLockRepository extends JpaRepository<BackfillLock, String> {

    /**
     * Compare-and-swap: take the lock only if nobody holds it. Returns rows updated (0 or 1).
     */
    @Modifying
    @Query("UPDATE BackfillLock l SET l.locked = true, l.holderJobId = NULL, l.acquiredAt = :now " +
           "WHERE l.name = :name AND l.locked = false")
    int tryAcquire(@Param("name") String name, @Param("now") LocalDateTime now);

    @Modifying
    @Query("UPDATE BackfillLock l SET l.holderJobId = :jobId " +
           "WHERE l.name = :name AND l.locked = true AND l.holderJobId IS NULL")
    int bindHolder(@Param("name") String name, @Param("jobId") Long jobId);

    @Modifying
    @Query("UPDATE BackfillLock l SET l.locked = false, l.holderJobId = NULL, l.acquiredAt = NULL " +
           "WHERE l.name = :name AND l.holderJobId = :jobId")
    int release(@Param("name") String name, @Param("jobId") Long jobId);
}
