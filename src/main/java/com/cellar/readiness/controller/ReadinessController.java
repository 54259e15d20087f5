package com.cellar.readiness.controller;

import com.cellar.readiness.domain.ReadinessResult;
import com.cellar.readiness.dto.VintageInversion;
import com.cellar.readiness.service.ReadinessService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/wines")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Readiness", description = "Drink-window readiness per wine")
public class ReadinessController {

    private final ReadinessService readinessService;

    @Operation(summary = "Get stored readiness", description = "The last computed readiness result for a wine")
    @GetMapping("/{wineId}/readiness")
    public ResponseEntity<?> getReadiness(@Parameter(description = "Wine ID") @PathVariable Long wineId) {
        return readinessService.getReadiness(wineId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(new ErrorResponse("No readiness computed for wine " + wineId)));
    }

    @Operation(
        summary = "Recompute readiness",
        description = "Synchronously recomputes and stores readiness for one wine with the current algorithm version"
    )
    @PostMapping("/{wineId}/readiness/recompute")
    public ResponseEntity<?> recompute(@Parameter(description = "Wine ID") @PathVariable Long wineId) {
        try {
            ReadinessResult result = readinessService.recomputeReadiness(wineId);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to recompute readiness for wine {}: {}", wineId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("Unexpected error: " + e.getMessage()));
        }
    }

    @Operation(
        summary = "Find vintage inversions",
        description = "In-stock vintages of the same wine where the older one is still TooYoung " +
                "but the younger one is already drinkable"
    )
    @GetMapping("/readiness/inversions")
    public List<VintageInversion> findInversions() {
        return readinessService.findVintageInversions();
    }

    public record ErrorResponse(String message) {}
}
