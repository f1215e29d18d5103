package com.propertyintel.listings.scheduler;

import com.propertyintel.listings.config.ListingStatsProperties;
import com.propertyintel.listings.output.ClickHouseWriter;
import com.propertyintel.listings.service.PipelineBusyException;
import com.propertyintel.listings.service.PipelineService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup pipeline runs.
 *
 * The scheduled run is off by default ("-"); set
 * listing-stats.scheduling.cron (or CRON) to recompute after each new
 * dataset snapshot.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineScheduler {

    private final PipelineService pipelineService;
    private final ClickHouseWriter clickHouseWriter;
    private final ListingStatsProperties properties;

    /**
     * On application startup:
     *  1. Ensure the ClickHouse schema exists unless running CSV-only
     *  2. Optionally run the pipeline once if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        if (properties.getOutput().getMode() != ListingStatsProperties.Output.OutputMode.CSV) {
            try {
                clickHouseWriter.ensureSchema();
            } catch (Exception e) {
                log.warn("Could not initialise ClickHouse schema: {}", e.getMessage());
            }
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, running pipeline");
            runSafely();
        } else {
            log.info("Pipeline ready. Schedule: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${listing-stats.scheduling.cron:-}", zone = "UTC")
    public void scheduledRun() {
        log.info("Scheduled pipeline run triggered");
        runSafely();
    }

    private void runSafely() {
        try {
            pipelineService.run();
        } catch (PipelineBusyException e) {
            log.warn("Skipping run: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Pipeline run failed: {}", e.getMessage(), e);
        }
    }
}
