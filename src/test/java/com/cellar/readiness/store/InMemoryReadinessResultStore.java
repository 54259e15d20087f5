package com.cellar.readiness.store;

import com.cellar.readiness.domain.ReadinessResult;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryReadinessResultStore implements ReadinessResultStore {

    private final Map<Long, ReadinessResult> results = new ConcurrentHashMap<>();
    private final Set<Long> failingWineIds = ConcurrentHashMap.newKeySet();
    private final AtomicInteger writes = new AtomicInteger();

    /** Saving a result for this wine throws, as a broken row would. */
    public void failOn(Long wineId) {
        failingWineIds.add(wineId);
    }

    public int getWrites() {
        return writes.get();
    }

    public Map<Long, ReadinessResult> snapshot() {
        return new HashMap<>(results);
    }

    @Override
    public Optional<ReadinessResult> find(long wineId) {
        return Optional.ofNullable(results.get(wineId));
    }

    @Override
    public Map<Long, ReadinessResult> findAll(Collection<Long> wineIds) {
        Map<Long, ReadinessResult> found = new HashMap<>();
        for (Long id : wineIds) {
            ReadinessResult result = results.get(id);
            if (result != null) {
                found.put(id, result);
            }
        }
        return found;
    }

    @Override
    public void save(long wineId, ReadinessResult result) {
        if (failingWineIds.contains(wineId)) {
            throw new IllegalStateException("constraint violation on wine " + wineId);
        }
        writes.incrementAndGet();
        results.put(wineId, result);
    }
}
