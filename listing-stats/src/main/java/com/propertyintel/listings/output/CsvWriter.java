package com.propertyintel.listings.output;

import com.opencsv.CSVWriter;
import com.propertyintel.listings.config.ListingStatsProperties;
import com.propertyintel.listings.model.AggregateRow;
import com.propertyintel.listings.model.OfferTypeSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.Function;

/**
 * Writes pipeline results to CSV files.
 *
 * Output path pattern: {outputDir}/price_per_area_{startedAt}.csv
 * e.g. /data/output/price_per_area_20250301T020000.csv
 *
 * The row order of the aggregate file is part of its contract
 * (year, region nulls first, offer type, property type).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private final ListingStatsProperties properties;

    static final String[] AGGREGATE_HEADERS = {
            "year", "region", "offer_type", "property_type",
            "mean_price_per_area", "median_price_per_area", "row_count"
    };

    static final String[] SUMMARY_HEADERS = {
            "offer_type", "min_price_per_area", "max_price_per_area",
            "mean_price_per_area", "row_count"
    };

    public Path writeAggregates(List<AggregateRow> rows, LocalDateTime runStartedAt) {
        return write("price_per_area", runStartedAt, AGGREGATE_HEADERS, rows, this::toRow);
    }

    public Path writeOfferTypeSummaries(List<OfferTypeSummary> summaries, LocalDateTime runStartedAt) {
        return write("offer_type_summary", runStartedAt, SUMMARY_HEADERS, summaries, this::toRow);
    }

    private <T> Path write(String prefix, LocalDateTime runStartedAt, String[] headers,
                           List<T> rows, Function<T, String[]> toRow) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        String filename = String.format("%s_%s.csv", prefix, FILE_TIMESTAMP.format(runStartedAt));
        Path outputPath = outputDir.resolve(filename);

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(
                     out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(headers);
            }

            for (T row : rows) {
                writer.writeNext(toRow.apply(row));
            }

            log.info("Written {} rows to CSV: {}", rows.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("CSV write failed", e);
        }
    }

    private String[] toRow(AggregateRow r) {
        return new String[]{
                str(r.getYear()),
                str(r.getRegion()),
                str(r.getOfferType()),
                str(r.getPropertyType()),
                str(r.getMeanPricePerArea()),
                str(r.getMedianPricePerArea()),
                str(r.getRowCount())
        };
    }

    private String[] toRow(OfferTypeSummary s) {
        return new String[]{
                str(s.getOfferType()),
                str(s.getMinPricePerArea()),
                str(s.getMaxPricePerArea()),
                str(s.getMeanPricePerArea()),
                str(s.getRowCount())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Cannot create output directory: " + dir, e);
        }
    }
}
