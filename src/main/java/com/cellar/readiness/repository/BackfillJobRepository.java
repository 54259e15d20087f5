package com.cellar.readiness.repository;

import com.cellar.readiness.domain.BackfillStatus;
import com.cellar.readiness.entity.BackfillJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface BackfillJobRepository extends JpaRepository<BackfillJob, Long> {

    List<BackfillJob> findTop20ByOrderByIdDesc();

    /**
     * Raise the cancel flag of a job in the given status. Entity saves never touch this column.
     */
    @Modifying
    @Query("UPDATE BackfillJob j SET j.cancelRequested = true WHERE j.id = :id AND j.status = :status")
    int requestCancel(@Param("id") Long id, @Param("status") BackfillStatus status);

    @Query("SELECT j.cancelRequested FROM BackfillJob j WHERE j.id = :id")
    Boolean findCancelRequested(@Param("id") Long id);

    @Modifying
    @Query("UPDATE BackfillJob j SET j.cancelRequested = false WHERE j.id = :id")
    int clearCancel(@Param("id") Long id);

    /**
     * Claim a running job for one step. A claim older than staleBefore is treated as abandoned.
     * Returns rows updated (0 or 1).
     */
    @Modifying
    @Query("UPDATE BackfillJob j SET j.stepping = true, j.stepClaimedAt = :now " +
           "WHERE j.id = :id AND j.status = :status " +
           "AND (j.stepping = false OR j.stepClaimedAt < :staleBefore)")
    int claimStep(@Param("id") Long id,
                  @Param("status") BackfillStatus status,
                  @Param("now") LocalDateTime now,
                  @Param("staleBefore") LocalDateTime staleBefore);

    @Modifying
    @Query("UPDATE BackfillJob j SET j.stepping = false, j.stepClaimedAt = NULL WHERE j.id = :id")
    int releaseStep(@Param("id") Long id);
}
