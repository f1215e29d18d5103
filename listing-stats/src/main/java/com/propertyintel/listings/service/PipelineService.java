package com.propertyintel.listings.service;

import com.propertyintel.listings.model.JoinedListing;
import com.propertyintel.listings.model.PipelineResult;
import com.propertyintel.listings.model.PipelineRun;
import com.propertyintel.listings.model.RawListing;
import com.propertyintel.listings.output.OutputRouter;
import com.propertyintel.listings.source.InputRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Orchestrates one batch run:
 *
 *   listings source → dedup → normalise → region join → filter chain → aggregate → sinks
 *
 * Listings flow through the stages as a single lazy stream, so only the
 * seen-id set, the region lookup and the per-group price buffers are held in
 * memory. Row counts at every stage boundary are logged and kept on the
 * {@link PipelineRun}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PipelineService {

    private final InputRouter inputRouter;
    private final OutputRouter outputRouter;
    private final ListingDeduplicator deduplicator;
    private final ListingNormalizer normalizer;
    private final RegionJoiner regionJoiner;
    private final ListingFilterChain filterChain;
    private final PriceStatsAggregator aggregator;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<PipelineRun> lastRun = new AtomicReference<>();
    private final AtomicReference<PipelineResult> lastResult = new AtomicReference<>();

    /**
     * Run the whole pipeline and write the results to the configured sinks.
     *
     * @throws PipelineBusyException if a run is already in progress
     */
    public PipelineResult run() {
        if (!running.compareAndSet(false, true)) {
            throw new PipelineBusyException("A pipeline run is already in progress");
        }

        PipelineRun run = PipelineRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();
        lastRun.set(run);
        log.info("Pipeline run {} started", run.getRunId());

        try {
            RegionLookup lookup = RegionLookup.of(inputRouter.loadRegions());
            log.info("Region lookup ready: {} districts", lookup.size());

            PipelineResult result;
            try (Stream<RawListing> listings = inputRouter.openListings()) {
                result = process(listings, lookup, run);
            }

            outputRouter.write(result);

            run.setStatus("SUCCESS");
            lastResult.set(result);
            return result;

        } catch (Exception e) {
            log.error("Pipeline run {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
            throw e;
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            outputRouter.writePipelineRun(run);
            running.set(false);
            log.info("Pipeline run {} finished with status {}", run.getRunId(), run.getStatus());
        }
    }

    /**
     * Push listings through every stage. Sources and sinks are not touched here.
     */
    PipelineResult process(Stream<RawListing> listings, RegionLookup lookup, PipelineRun run) {
        AtomicLong read = new AtomicLong();
        AtomicLong unique = new AtomicLong();
        AtomicLong resolved = new AtomicLong();
        AtomicLong accepted = new AtomicLong();
        Map<String, Long> rejected = new LinkedHashMap<>();

        Stream<JoinedListing> valid = deduplicator.deduplicate(listings.peek(l -> read.incrementAndGet()))
                .peek(l -> unique.incrementAndGet())
                .map(normalizer::normalize)
                .map(l -> regionJoiner.join(l, lookup))
                .peek(l -> {
                    if (l.getRegion() != null) resolved.incrementAndGet();
                })
                .filter(l -> {
                    String failedRule = filterChain.firstFailingRule(l);
                    if (failedRule != null) {
                        rejected.merge(failedRule, 1L, Long::sum);
                        return false;
                    }
                    return true;
                })
                .peek(l -> accepted.incrementAndGet());

        AggregationResult aggregation = aggregator.aggregate(valid);

        run.setListingsRead(read.get());
        run.setAfterDeduplication(unique.get());
        run.setRegionResolved(resolved.get());
        run.setAfterFilters(accepted.get());
        run.setSkippedWithoutYear(aggregation.skippedWithoutYear());
        run.setSkippedWithoutPrice(aggregation.skippedWithoutPrice());
        run.setAggregateGroups(aggregation.rows().size());
        run.setRejectedByRule(rejected);

        log.info("Run {}: read={} deduplicated={} regionResolved={} valid={} groups={}",
                run.getRunId(), read.get(), unique.get(), resolved.get(), accepted.get(),
                aggregation.rows().size());
        log.info("Run {}: rejected by rule {}", run.getRunId(), rejected);

        return new PipelineResult(run, aggregation.rows(), aggregation.offerTypeSummaries());
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<PipelineRun> getLastRun() {
        return Optional.ofNullable(lastRun.get());
    }

    public Optional<PipelineResult> getLastResult() {
        return Optional.ofNullable(lastResult.get());
    }
}
