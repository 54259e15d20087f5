package com.cellar.readiness.controller;

import com.cellar.readiness.profile.OpenAiProfileGenerator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/wines")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Wine Profile", description = "AI structural profiles")
public class WineProfileController {

    private final OpenAiProfileGenerator profileGenerator;

    @Operation(
        summary = "Generate AI profile",
        description = "Asks OpenAI for body, tannin, acidity, oak and sweetness and stores the profile on the wine. " +
                "Returns 503 when generation is unavailable; readiness then keeps using the heuristic profile."
    )
    @PostMapping("/{wineId}/profile")
    public ResponseEntity<?> generateProfile(@Parameter(description = "Wine ID") @PathVariable Long wineId) {
        log.info("Profile generation requested for wine {}", wineId);
        try {
            return profileGenerator.generate(wineId)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                            .body(new ErrorResponse("Profile generation unavailable, heuristic profile stays in use")));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getMessage()));
        }
    }

    public record ErrorResponse(String message) {}
}
