package com.propertyintel.listings.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks each pipeline run for auditability.
 * Stored in the pipeline_runs table in ClickHouse and returned by /pipeline/status.
 */
@Data
@Builder
public class PipelineRun {

    private String runId;           // UUID
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED

    // ── Stage boundary counts ───────────────────────────────────────────────
    private long listingsRead;
    private long afterDeduplication;
    private long regionResolved;
    private long afterFilters;
    private long skippedWithoutYear;
    private long skippedWithoutPrice;
    private int aggregateGroups;

    /** Rows rejected per rule, attributed to the first rule that failed */
    @Builder.Default
    private Map<String, Long> rejectedByRule = new LinkedHashMap<>();

    private String errorMessage;    // null on success
}
