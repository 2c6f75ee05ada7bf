package com.medexus.backend.modules.seed.presentation;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medexus.backend.modules.seed.application.DemoSeedService;
import com.medexus.backend.modules.seed.application.DemoSeedService.SeedSummary;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@ConditionalOnProperty(value = "app.seed.enabled", havingValue = "true")
public class DemoSeedController {

    private final DemoSeedService demoSeedService;
    private final Clock clock;

    public DemoSeedController(DemoSeedService demoSeedService, Clock clock) {
        this.demoSeedService = demoSeedService;
        this.clock = clock;
    }

    @Operation(summary = "Reset demo data", description = "Deletes every account, request and interest, then loads the demo set.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Demo data loaded")
    })
    @PostMapping("/seed-data")
    public ResponseEntity<SeedResponse> resetDemoDataset() {
        SeedSummary summary = demoSeedService.resetDemoDataset();
        return ResponseEntity.ok(new SeedResponse("Seed data created successfully", OffsetDateTime.now(clock), summary));
    }

    public record SeedResponse(String message, OffsetDateTime executedAt, SeedSummary summary) {
    }
}
