package com.cellar.readiness.store;

import com.cellar.readiness.domain.ReadinessResult;
import com.cellar.readiness.entity.WineReadinessEntity;
import com.cellar.readiness.repository.WineReadinessRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaReadinessResultStore implements ReadinessResultStore {

    private final WineReadinessRepository readinessRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<ReadinessResult> find(long wineId) {
        return readinessRepository.findById(wineId).map(JpaReadinessResultStore::toResult);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Long, ReadinessResult> findAll(Collection<Long> wineIds) {
        Map<Long, ReadinessResult> results = new HashMap<>();
        if (wineIds.isEmpty()) {
            return results;
        }
        for (WineReadinessEntity entity : readinessRepository.findByWineIdIn(wineIds)) {
            results.put(entity.getWineId(), toResult(entity));
        }
        return results;
    }

    @Override
    @Transactional
    public void save(long wineId, ReadinessResult result) {
        WineReadinessEntity entity = WineReadinessEntity.builder()
                .wineId(wineId)
                .readinessScore(result.getScore())
                .readinessStatus(result.getStatus())
                .drinkWindowStart(result.getDrinkWindowStart())
                .drinkWindowEnd(result.getDrinkWindowEnd())
                .confidence(result.getConfidence())
                .reasons(new ArrayList<>(result.getReasons()))
                .algorithmVersion(result.getAlgorithmVersion())
                .computedAt(LocalDateTime.now(clock))
                .build();
        readinessRepository.save(entity);
    }

    static ReadinessResult toResult(WineReadinessEntity entity) {
        ReadinessResult.ReadinessResultBuilder builder = ReadinessResult.builder()
                .score(entity.getReadinessScore())
                .status(entity.getReadinessStatus())
                .drinkWindowStart(entity.getDrinkWindowStart())
                .drinkWindowEnd(entity.getDrinkWindowEnd())
                .confidence(entity.getConfidence())
                .algorithmVersion(entity.getAlgorithmVersion());
        if (entity.getReasons() != null) {
            builder.reasons(entity.getReasons());
        }
        return builder.build();
    }
}
