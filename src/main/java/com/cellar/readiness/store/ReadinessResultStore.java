package com.cellar.readiness.store;

import com.cellar.readiness.domain.ReadinessResult;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

public interface ReadinessResultStore {

    Optional<ReadinessResult> find(long wineId);

    Map<Long, ReadinessResult> findAll(Collection<Long> wineIds);

    /**
     * Insert or overwrite the result for a wine.
     */
    void save(long wineId, ReadinessResult result);
}
