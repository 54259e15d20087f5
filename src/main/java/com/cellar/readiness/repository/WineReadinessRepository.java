package com.cellar.readiness.repository;

import com.cellar.readiness.entity.WineReadinessEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface WineReadinessRepository extends JpaRepository<WineReadinessEntity, Long> {

    List<WineReadinessEntity> findByWineIdIn(Collection<Long> wineIds);

    long countByAlgorithmVersion(Integer algorithmVersion);
}
