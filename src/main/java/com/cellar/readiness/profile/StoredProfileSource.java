package com.cellar.readiness.profile;

import com.cellar.readiness.domain.Confidence;
import com.cellar.readiness.domain.ProfileOrigin;
import com.cellar.readiness.domain.StructuralProfile;
import com.cellar.readiness.dto.WineProfilePayload;
import com.cellar.readiness.entity.WineEntity;
import com.cellar.readiness.repository.WineRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads the AI profile stored on the wine row.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StoredProfileSource implements ProfileSource {

    private final WineRepository wineRepository;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<StructuralProfile> getProfile(long wineId) {
        return wineRepository.findById(wineId)
                .map(WineEntity::getWineProfileJson)
                .flatMap(json -> parse(wineId, json));
    }

    Optional<StructuralProfile> parse(long wineId, String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            WineProfilePayload payload = objectMapper.readValue(json, WineProfilePayload.class);
            if (!payload.hasAllAxes()) {
                log.debug("Stored profile for wine {} is incomplete, ignoring it", wineId);
                return Optional.empty();
            }
            return Optional.of(toProfile(payload));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable stored profile for wine {}: {}", wineId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static StructuralProfile toProfile(WineProfilePayload payload) {
        return StructuralProfile.of(
                payload.getBody(),
                payload.getTannin(),
                payload.getAcidity(),
                payload.getOak(),
                payload.getSweetness(),
                Confidence.fromString(payload.getConfidence()),
                ProfileOrigin.AI);
    }
}
