package com.propertyintel.listings.source;

import com.opencsv.bean.CsvToBeanBuilder;
import com.propertyintel.listings.model.RegionReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads the district → region reference table from a CSV export.
 * The table is small (~80 districts) and read fully.
 */
@Component
@Slf4j
public class CsvRegionReader {

    public List<RegionReference> read(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<RegionReference> references = new CsvToBeanBuilder<RegionCsvRow>(reader)
                    .withType(RegionCsvRow.class)
                    .withIgnoreLeadingWhiteSpace(true)
                    .withIgnoreEmptyLine(true)
                    .build()
                    .parse()
                    .stream()
                    .map(RegionCsvRow::toReference)
                    .toList();

            log.info("Loaded {} region reference rows from {}", references.size(), path);
            return references;

        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read region reference CSV " + path, e);
        }
    }
}
