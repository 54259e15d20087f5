package com.cellar.readiness.service;

import com.cellar.readiness.config.ReadinessProperties;
import com.cellar.readiness.domain.BottleRecord;
import com.cellar.readiness.domain.ReadinessResult;
import com.cellar.readiness.domain.ReadinessStatus;
import com.cellar.readiness.domain.StructuralProfile;
import com.cellar.readiness.domain.WineRecord;
import com.cellar.readiness.dto.VintageInversion;
import com.cellar.readiness.engine.ReadinessCalculator;
import com.cellar.readiness.profile.ProfileSource;
import com.cellar.readiness.store.ReadinessResultStore;
import com.cellar.readiness.store.WineStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Readiness for single wines: compute, store, read back.
 * The backfill reuses {@link #computeFor(WineRecord)} so both paths produce identical results.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReadinessService {

    private final WineStore wineStore;
    private final ReadinessResultStore resultStore;
    private final ProfileSource profileSource;
    private final ReadinessCalculator calculator;
    private final ReadinessProperties properties;
    private final Clock clock;

    /**
     * Recompute and store the readiness of one wine.
     *
     * @throws IllegalArgumentException when the wine does not exist
     */
    public ReadinessResult recomputeReadiness(long wineId) {
        WineRecord wine = wineStore.findWine(wineId)
                .orElseThrow(() -> new IllegalArgumentException("Wine not found: " + wineId));
        ReadinessResult result = computeFor(wine);
        resultStore.save(wineId, result);
        log.info("Recomputed readiness for wine {} ({}): {} {}", wineId, wine.getWineName(),
                result.getStatus().getLabel(), result.getScore());
        return result;
    }

    public Optional<ReadinessResult> getReadiness(long wineId) {
        return resultStore.find(wineId);
    }

    /**
     * Pure computation with the configured algorithm version. Uses the stored AI profile
     * when there is one; the calculator falls back to the heuristic otherwise.
     */
    public ReadinessResult computeFor(WineRecord wine) {
        return computeFor(wine, properties.getAlgorithmVersion());
    }

    /**
     * Same as {@link #computeFor(WineRecord)} with an explicit version, so a running
     * backfill keeps stamping the version it started with.
     */
    public ReadinessResult computeFor(WineRecord wine, int algorithmVersion) {
        StructuralProfile profile = wine.getId() != null
                ? profileSource.getProfile(wine.getId()).orElse(null)
                : null;
        return calculator.compute(wine, currentYear(), profile, algorithmVersion);
    }

    public int currentYear() {
        return Year.now(clock).getValue();
    }

    public int algorithmVersion() {
        return properties.getAlgorithmVersion();
    }

    /**
     * In-stock vintages of the same wine (producer + name) where an older vintage is still
     * too young while the next younger one is already drinkable.
     */
    public List<VintageInversion> findVintageInversions() {
        Map<String, Map<Long, WineRecord>> byIdentity = new LinkedHashMap<>();
        for (BottleRecord bottle : wineStore.getInStockBottles()) {
            WineRecord wine = bottle.getWine();
            if (wine.getVintageYear() == null) {
                continue;
            }
            byIdentity.computeIfAbsent(identity(wine), key -> new LinkedHashMap<>())
                    .putIfAbsent(wine.getId(), wine);
        }

        List<Long> wineIds = byIdentity.values().stream()
                .flatMap(group -> group.keySet().stream())
                .collect(Collectors.toList());
        Map<Long, ReadinessResult> results = resultStore.findAll(wineIds);

        List<VintageInversion> inversions = new ArrayList<>();
        for (Map<Long, WineRecord> group : byIdentity.values()) {
            if (group.size() < 2) {
                continue;
            }
            List<WineRecord> vintages = new ArrayList<>(group.values());
            vintages.sort(Comparator.comparing(WineRecord::getVintageYear));

            for (int i = 0; i < vintages.size() - 1; i++) {
                WineRecord older = vintages.get(i);
                WineRecord younger = vintages.get(i + 1);
                ReadinessResult olderResult = results.get(older.getId());
                ReadinessResult youngerResult = results.get(younger.getId());
                if (olderResult == null || youngerResult == null) {
                    continue;
                }
                if (olderResult.getStatus() == ReadinessStatus.TOO_YOUNG && youngerResult.getStatus().isDrinkable()) {
                    log.warn("Vintage inversion for {} / {}: {} is TooYoung but {} is {}",
                            older.getProducer(), older.getWineName(), older.getVintageYear(),
                            younger.getVintageYear(), youngerResult.getStatus().getLabel());
                    inversions.add(VintageInversion.builder()
                            .wineName(older.getWineName())
                            .producer(older.getProducer())
                            .olderWineId(older.getId())
                            .olderVintage(older.getVintageYear())
                            .olderStatus(olderResult.getStatus())
                            .youngerWineId(younger.getId())
                            .youngerVintage(younger.getVintageYear())
                            .youngerStatus(youngerResult.getStatus())
                            .issue(String.format("%d is marked %s but %d is marked %s",
                                    older.getVintageYear(), olderResult.getStatus().getLabel(),
                                    younger.getVintageYear(), youngerResult.getStatus().getLabel()))
                            .build());
                }
            }
        }
        return inversions;
    }

    private static String identity(WineRecord wine) {
        String producer = wine.getProducer() != null ? wine.getProducer() : "unknown";
        String name = wine.getWineName() != null ? wine.getWineName() : "";
        return (producer.trim() + "::" + name.trim()).toLowerCase(Locale.ROOT);
    }
}
