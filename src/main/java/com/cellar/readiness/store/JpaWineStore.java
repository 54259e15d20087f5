package com.cellar.readiness.store;

import com.cellar.readiness.domain.BackfillFilter;
import com.cellar.readiness.domain.BottleRecord;
import com.cellar.readiness.domain.WineColor;
import com.cellar.readiness.domain.WinePage;
import com.cellar.readiness.domain.WineRecord;
import com.cellar.readiness.entity.BottleEntity;
import com.cellar.readiness.entity.WineEntity;
import com.cellar.readiness.exception.FatalStorageException;
import com.cellar.readiness.repository.BottleRepository;
import com.cellar.readiness.repository.WineRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@Slf4j
@RequiredArgsConstructor
public class JpaWineStore implements WineStore {

    private final WineRepository wineRepository;
    private final BottleRepository bottleRepository;

    @Override
    @Transactional(readOnly = true)
    public WinePage listWines(BackfillFilter filter, Long cursor, int limit) {
        long after = cursor != null ? cursor : 0L;
        Pageable page = PageRequest.of(0, limit);
        try {
            List<WineEntity> entities;
            switch (filter.getMode()) {
                case MISSING_ONLY:
                    entities = wineRepository.findMissingReadinessAfter(after, page);
                    break;
                case STALE_OR_MISSING:
                    entities = wineRepository.findStaleOrMissingAfter(after, filter.getAlgorithmVersion(), page);
                    break;
                case FORCE_ALL:
                default:
                    entities = wineRepository.findPageAfter(after, page);
                    break;
            }
            List<WineRecord> rows = new ArrayList<>(entities.size());
            for (WineEntity entity : entities) {
                rows.add(toRecord(entity));
            }
            log.debug("Fetched {} wines after cursor {} (mode {})", rows.size(), cursor, filter.getMode());
            return WinePage.of(rows);
        } catch (DataAccessException e) {
            throw new FatalStorageException("Failed to page wines after cursor " + cursor, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countWines(BackfillFilter filter) {
        try {
            switch (filter.getMode()) {
                case MISSING_ONLY:
                    return wineRepository.countMissingReadiness();
                case STALE_OR_MISSING:
                    return wineRepository.countStaleOrMissing(filter.getAlgorithmVersion());
                case FORCE_ALL:
                default:
                    return wineRepository.count();
            }
        } catch (DataAccessException e) {
            throw new FatalStorageException("Failed to count wines for mode " + filter.getMode(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WineRecord> findWine(long wineId) {
        return wineRepository.findById(wineId).map(JpaWineStore::toRecord);
    }

    @Override
    @Transactional(readOnly = true)
    public List<BottleRecord> getInStockBottles() {
        List<BottleRecord> bottles = new ArrayList<>();
        for (BottleEntity bottle : bottleRepository.findInStockWithWine()) {
            WineEntity wine = bottle.getWine();
            bottles.add(BottleRecord.builder()
                    .bottleId(bottle.getId())
                    .quantity(bottle.getQuantity() != null ? bottle.getQuantity() : 0)
                    .rating(wine.getRating())
                    .wine(toRecord(wine))
                    .build());
        }
        return bottles;
    }

    static WineRecord toRecord(WineEntity entity) {
        return WineRecord.builder()
                .id(entity.getId())
                .wineName(entity.getWineName())
                .producer(entity.getProducer())
                .vintageYear(entity.getVintage())
                .color(WineColor.fromString(entity.getColor()))
                .grapes(entity.getGrapes() != null ? entity.getGrapes() : List.of())
                .region(entity.getRegion())
                .appellation(entity.getAppellation())
                .build();
    }
}
