package com.cellar.readiness.controller;

import com.cellar.readiness.domain.Confidence;
import com.cellar.readiness.domain.FoodProfile;
import com.cellar.readiness.domain.LineupCandidate;
import com.cellar.readiness.domain.LineupPlan;
import com.cellar.readiness.domain.ProfileOrigin;
import com.cellar.readiness.domain.ReadinessResult;
import com.cellar.readiness.domain.StructuralProfile;
import com.cellar.readiness.domain.WineColor;
import com.cellar.readiness.service.LineupService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/lineups")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Lineup", description = "Food pairing and light-to-bold tasting order")
public class LineupController {

    private final LineupService lineupService;

    @Operation(
        summary = "Order a candidate pool",
        description = "Scores each candidate against the dish and returns the tasting order for the seat count"
    )
    @PostMapping("/score")
    public ResponseEntity<?> scoreLineup(@RequestBody ScoreLineupRequest request) {
        if (request == null || request.candidates() == null) {
            return ResponseEntity.badRequest().body(new ErrorResponse("candidates are required"));
        }
        List<LineupCandidate> pool = new ArrayList<>(request.candidates().size());
        for (CandidateRequest candidate : request.candidates()) {
            pool.add(candidate.toCandidate());
        }
        LineupPlan plan = lineupService.scoreLineup(pool, request.food(), request.seatCount());
        return ResponseEntity.ok(plan);
    }

    @Operation(
        summary = "Plan from the cellar",
        description = "Builds the candidate pool from in-stock bottles and returns the tasting order"
    )
    @PostMapping("/plan")
    public ResponseEntity<?> planFromCellar(@RequestBody PlanRequest request) {
        try {
            LineupPlan plan = lineupService.planFromCellar(request.food(), request.seatCount());
            return ResponseEntity.ok(plan);
        } catch (Exception e) {
            log.error("Failed to plan lineup: {}", e.getMessage(), e);
            return ResponseEntity.status(500).body(new ErrorResponse("Unexpected error: " + e.getMessage()));
        }
    }

    public record PlanRequest(FoodProfile food, int seatCount) {}

    public record ScoreLineupRequest(List<CandidateRequest> candidates, FoodProfile food, int seatCount) {}

    public record ProfileRequest(int body, int tannin, int acidity, int oak, int sweetness, Confidence confidence) {

        StructuralProfile toProfile() {
            // power is always derived, never accepted from the caller
            return StructuralProfile.of(body, tannin, acidity, oak, sweetness, confidence, ProfileOrigin.AI);
        }
    }

    public record CandidateRequest(Long bottleId, Long wineId, String wineName, Integer vintageYear,
                                   WineColor color, int quantity, Double rating,
                                   ReadinessResult readiness, ProfileRequest profile) {

        LineupCandidate toCandidate() {
            return LineupCandidate.builder()
                    .bottleId(bottleId)
                    .wineId(wineId)
                    .wineName(wineName)
                    .vintageYear(vintageYear)
                    .color(color)
                    .quantity(quantity)
                    .rating(rating)
                    .readiness(readiness)
                    .profile(profile != null ? profile.toProfile() : null)
                    .build();
        }
    }

    public record ErrorResponse(String message) {}
}
