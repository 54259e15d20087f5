package com.cellar.readiness.store;

import com.cellar.readiness.domain.BackfillFilter;
import com.cellar.readiness.domain.BottleRecord;
import com.cellar.readiness.domain.WinePage;
import com.cellar.readiness.domain.WineRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to wine rows.
 * Implementations throw {@link com.cellar.readiness.exception.FatalStorageException}
 * when the underlying storage cannot be reached.
 */
public interface WineStore {

    /**
     * Up to {@code limit} rows matching the filter with an id strictly greater than
     * {@code cursor} (all rows when null), ordered by id.
     */
    WinePage listWines(BackfillFilter filter, Long cursor, int limit);

    long countWines(BackfillFilter filter);

    Optional<WineRecord> findWine(long wineId);

    List<BottleRecord> getInStockBottles();
}
