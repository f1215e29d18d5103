package com.propertyintel.listings.config;

import com.propertyintel.listings.model.AggregateRow;
import com.propertyintel.listings.model.PipelineResult;
import com.propertyintel.listings.service.PipelineBusyException;
import com.propertyintel.listings.service.PipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@Slf4j
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineService pipelineService;

    // ── Run triggers ──────────────────────────────────────────────────────────

    @PostMapping("/pipeline/run")
    public ResponseEntity<Map<String, String>> triggerRun() {
        if (pipelineService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "a pipeline run is already in progress"));
        }
        new Thread(this::runInBackground, "manual-pipeline-run").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    @GetMapping("/pipeline/status")
    public ResponseEntity<?> status() {
        return pipelineService.getLastRun()
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of(
                        "service", "property-intel-listing-stats",
                        "status", "no run yet")));
    }

    // ── Result query API ──────────────────────────────────────────────────────

    /**
     * Aggregates of the last successful run.
     *
     * GET /stats?year=2025&region=Jihomoravský kraj&offerType=sale
     *
     * All filters are optional; region is matched case-insensitively.
     * An empty region ({@code region=}) selects the groups whose district did
     * not resolve to a region.
     */
    @GetMapping("/stats")
    public ResponseEntity<?> stats(
            @RequestParam Optional<Integer> year,
            @RequestParam(required = false) String region,
            @RequestParam Optional<String> offerType) {
        Optional<PipelineResult> result = pipelineService.getLastResult();
        if (result.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "no completed pipeline run"));
        }

        List<AggregateRow> rows = result.get().aggregates().stream()
                .filter(r -> year.map(y -> y == r.getYear()).orElse(true))
                .filter(r -> matchesRegion(region, r.getRegion()))
                .filter(r -> offerType.map(o -> o.equals(r.getOfferType())).orElse(true))
                .toList();

        return ResponseEntity.ok(Map.of(
                "runId", result.get().run().getRunId(),
                "rows", rows,
                "offerTypeSummaries", result.get().offerTypeSummaries()));
    }

    private static boolean matchesRegion(String requested, String region) {
        if (requested == null) return true;
        if (requested.isBlank()) return region == null;
        return requested.equalsIgnoreCase(region);
    }

    private void runInBackground() {
        try {
            pipelineService.run();
        } catch (PipelineBusyException e) {
            log.warn("Manual run skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Manual pipeline run failed: {}", e.getMessage(), e);
        }
    }
}
