package com.cellar.readiness.service;

import com.cellar.readiness.domain.BottleRecord;
import com.cellar.readiness.domain.FoodProfile;
import com.cellar.readiness.domain.LineupCandidate;
import com.cellar.readiness.domain.LineupPlan;
import com.cellar.readiness.domain.ReadinessResult;
import com.cellar.readiness.domain.StructuralProfile;
import com.cellar.readiness.domain.WineRecord;
import com.cellar.readiness.engine.HeuristicProfileEstimator;
import com.cellar.readiness.engine.LineupOrderer;
import com.cellar.readiness.engine.ReadinessCalculator;
import com.cellar.readiness.profile.ProfileSource;
import com.cellar.readiness.store.ReadinessResultStore;
import com.cellar.readiness.store.WineStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class LineupService {

    private final LineupOrderer orderer;
    private final WineStore wineStore;
    private final ReadinessResultStore resultStore;
    private final ProfileSource profileSource;
    private final HeuristicProfileEstimator heuristicEstimator;
    private final ReadinessService readinessService;

    public LineupPlan scoreLineup(List<LineupCandidate> candidatePool, FoodProfile food, int seatCount) {
        return orderer.order(candidatePool, food, seatCount);
    }

    /**
     * Plan an evening from the in-stock cellar. Wines without a stored readiness result are
     * computed on the fly (not persisted); wines without an AI profile use the heuristic one.
     */
    public LineupPlan planFromCellar(FoodProfile food, int seatCount) {
        List<LineupCandidate> pool = buildCellarPool();
        LineupPlan plan = orderer.order(pool, food, seatCount);
        log.info("Planned lineup for {} seats from {} in-stock bottles: {} wines, largest step {}{}",
                seatCount, pool.size(), plan.getSlots().size(), plan.getLargestPowerStep(),
                plan.isBestEffort() ? " (best effort)" : "");
        return plan;
    }

    List<LineupCandidate> buildCellarPool() {
        List<BottleRecord> bottles = wineStore.getInStockBottles();
        List<Long> wineIds = bottles.stream()
                .map(bottle -> bottle.getWine().getId())
                .distinct()
                .collect(Collectors.toList());
        Map<Long, ReadinessResult> readiness = new HashMap<>(resultStore.findAll(wineIds));
        Map<Long, StructuralProfile> profiles = new HashMap<>();

        List<LineupCandidate> pool = new ArrayList<>(bottles.size());
        for (BottleRecord bottle : bottles) {
            WineRecord wine = bottle.getWine();
            StructuralProfile profile = profiles.computeIfAbsent(wine.getId(), id -> profileFor(wine));
            ReadinessResult result = readiness.computeIfAbsent(wine.getId(), id -> readinessService.computeFor(wine));
            pool.add(LineupCandidate.builder()
                    .bottleId(bottle.getBottleId())
                    .wineId(wine.getId())
                    .wineName(wine.getWineName())
                    .vintageYear(wine.getVintageYear())
                    .color(wine.getColor())
                    .quantity(bottle.getQuantity())
                    .rating(bottle.getRating())
                    .readiness(result)
                    .profile(profile)
                    .build());
        }
        return pool;
    }

    private StructuralProfile profileFor(WineRecord wine) {
        return profileSource.getProfile(wine.getId())
                .orElseGet(() -> heuristicEstimator.estimate(
                        wine.getGrapes(), ReadinessCalculator.regionText(wine), wine.getColor()));
    }
}
