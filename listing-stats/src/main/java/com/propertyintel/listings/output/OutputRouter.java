package com.propertyintel.listings.output;

import com.propertyintel.listings.config.ListingStatsProperties;
import com.propertyintel.listings.model.PipelineResult;
import com.propertyintel.listings.model.PipelineRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes output to the appropriate sink(s) based on configuration.
 * Supports CLICKHOUSE, CSV, or BOTH modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final ClickHouseWriter clickHouseWriter;
    private final CsvWriter csvWriter;
    private final ListingStatsProperties properties;

    public void write(PipelineResult result) {
        ListingStatsProperties.Output.OutputMode mode = properties.getOutput().getMode();

        switch (mode) {
            case CLICKHOUSE -> writeClickHouse(result);
            case CSV -> writeCsv(result);
            case BOTH -> {
                writeClickHouse(result);
                writeCsv(result);
            }
        }
    }

    public void writePipelineRun(PipelineRun run) {
        try {
            if (properties.getOutput().getMode() != ListingStatsProperties.Output.OutputMode.CSV) {
                clickHouseWriter.writePipelineRun(run);
            }
        } catch (Exception e) {
            log.warn("Failed to write pipeline run metadata: {}", e.getMessage());
        }
    }

    private void writeClickHouse(PipelineResult result) {
        String runId = result.run().getRunId();
        clickHouseWriter.writeAggregates(runId, result.aggregates());
        clickHouseWriter.writeOfferTypeSummaries(runId, result.offerTypeSummaries());
    }

    private void writeCsv(PipelineResult result) {
        csvWriter.writeAggregates(result.aggregates(), result.run().getStartedAt());
        csvWriter.writeOfferTypeSummaries(result.offerTypeSummaries(), result.run().getStartedAt());
    }
}
