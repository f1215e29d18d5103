package com.propertyintel.listings.output;

import com.propertyintel.listings.model.AggregateRow;
import com.propertyintel.listings.model.OfferTypeSummary;
import com.propertyintel.listings.model.PipelineRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
@Slf4j
@RequiredArgsConstructor
public class ClickHouseWriter {

    private static final int BATCH_SIZE = 1000;
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring ClickHouse schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS property_intel.region_price_stats
            (
                run_id                  String,
                year                    UInt16,
                region                  LowCardinality(Nullable(String)),
                offer_type              LowCardinality(String),
                property_type           LowCardinality(String),
                mean_price_per_area     Float64,
                median_price_per_area   Float64,
                row_count               UInt64
            )
            ENGINE = MergeTree()
            ORDER BY (run_id, year, offer_type, property_type)
            SETTINGS allow_nullable_key = 1
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS property_intel.offer_type_summary
            (
                run_id                  String,
                offer_type              LowCardinality(String),
                min_price_per_area      Float64,
                max_price_per_area      Float64,
                mean_price_per_area     Float64,
                row_count               UInt64
            )
            ENGINE = MergeTree()
            ORDER BY (run_id, offer_type)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS property_intel.pipeline_runs
            (
                run_id                  String,
                started_at              DateTime,
                completed_at            Nullable(DateTime),
                status                  LowCardinality(String),
                listings_read           Int64,
                after_deduplication     Int64,
                region_resolved         Int64,
                after_filters           Int64,
                skipped_without_year    Int64,
                skipped_without_price   Int64,
                aggregate_groups        Int32,
                rejected_by_rule        Map(String, Int64),
                error_message           Nullable(String)
            )
            ENGINE = MergeTree()
            ORDER BY started_at
        """);

        log.info("ClickHouse schema ready.");
    }

    public void writeAggregates(String runId, List<AggregateRow> rows) {
        if (rows.isEmpty()) return;

        int total = rows.size();
        log.info("Writing {} aggregate rows to ClickHouse in batches of {}", total, BATCH_SIZE);

        for (int i = 0; i < total; i += BATCH_SIZE) {
            List<AggregateRow> batch = rows.subList(i, Math.min(i + BATCH_SIZE, total));
            try {
                jdbcTemplate.execute(aggregateInsert(runId, batch));
                log.debug("Wrote batch {}/{}", Math.min(i + BATCH_SIZE, total), total);
            } catch (Exception e) {
                log.error("Batch write failed at offset {}: {}", i, e.getMessage(), e);
                throw e;
            }
        }

        log.info("Successfully wrote {} aggregate rows", total);
    }

    public void writeOfferTypeSummaries(String runId, List<OfferTypeSummary> summaries) {
        if (summaries.isEmpty()) return;

        String rows = summaries.stream()
                .map(s -> String.format("(%s,%s,%s,%s,%s,%d)",
                        sqlStr(runId),
                        sqlStr(s.getOfferType()),
                        s.getMinPricePerArea(),
                        s.getMaxPricePerArea(),
                        s.getMeanPricePerArea(),
                        s.getRowCount()))
                .collect(Collectors.joining(",\n"));

        jdbcTemplate.execute("""
            INSERT INTO property_intel.offer_type_summary
            (run_id, offer_type, min_price_per_area, max_price_per_area, mean_price_per_area, row_count)
            VALUES
            """ + rows);
        log.info("Successfully wrote {} offer type summaries", summaries.size());
    }

    /**
     * Build a single INSERT ... VALUES statement with all rows in the batch.
     * The ClickHouse JDBC driver handles this more reliably than
     * PreparedStatement batches.
     */
    String aggregateInsert(String runId, List<AggregateRow> batch) {
        StringBuilder sql = new StringBuilder("""
            INSERT INTO property_intel.region_price_stats
            (run_id, year, region, offer_type, property_type,
             mean_price_per_area, median_price_per_area, row_count)
            VALUES
            """);

        String rows = batch.stream()
                .map(r -> String.format("(%s,%d,%s,%s,%s,%s,%s,%d)",
                        sqlStr(runId),
                        r.getYear(),
                        sqlStr(r.getRegion()),
                        sqlStr(r.getOfferType()),
                        sqlStr(r.getPropertyType()),
                        r.getMeanPricePerArea(),
                        r.getMedianPricePerArea(),
                        r.getRowCount()))
                .collect(Collectors.joining(",\n"));

        return sql.append(rows).toString();
    }

    public void writePipelineRun(PipelineRun run) {
        try {
            String sql = String.format("""
                INSERT INTO property_intel.pipeline_runs
                (run_id, started_at, completed_at, status, listings_read, after_deduplication,
                 region_resolved, after_filters, skipped_without_year, skipped_without_price, aggregate_groups,
                 rejected_by_rule, error_message)
                VALUES (%s,%s,%s,%s,%d,%d,%d,%d,%d,%d,%d,%s,%s)
                """,
                    sqlStr(run.getRunId()),
                    sqlDateTime(run.getStartedAt()),
                    sqlDateTime(run.getCompletedAt()),
                    sqlStr(run.getStatus()),
                    run.getListingsRead(),
                    run.getAfterDeduplication(),
                    run.getRegionResolved(),
                    run.getAfterFilters(),
                    run.getSkippedWithoutYear(),
                    run.getSkippedWithoutPrice(),
                    run.getAggregateGroups(),
                    sqlMap(run.getRejectedByRule()),
                    sqlStr(run.getErrorMessage())
            );
            jdbcTemplate.execute(sql);
        } catch (Exception e) {
            log.warn("Failed to write pipeline run: {}", e.getMessage());
        }
    }

    private String sqlStr(Object val) {
        if (val == null) return "NULL";
        return "'" + val.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private String sqlDateTime(LocalDateTime val) {
        return val == null ? "NULL" : sqlStr(DATE_TIME.format(val));
    }

    private String sqlMap(Map<String, Long> counts) {
        return counts.entrySet().stream()
                .map(e -> sqlStr(e.getKey()) + ":" + e.getValue())
                .collect(Collectors.joining(",", "{", "}"));
    }
}
