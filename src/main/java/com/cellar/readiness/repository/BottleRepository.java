package com.cellar.readiness.repository;

import com.cellar.readiness.entity.BottleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BottleRepository extends JpaRepository<BottleEntity, Long> {

    /**
     * In-stock bottles with their wine loaded (avoids N+1 when building a lineup)
     */
    @Query("SELECT b FROM BottleEntity b JOIN FETCH b.wine WHERE b.quantity > 0 ORDER BY b.id ASC")
    List<BottleEntity> findInStockWithWine();
}
