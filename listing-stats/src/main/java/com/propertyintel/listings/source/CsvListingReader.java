package com.propertyintel.listings.source;

import com.opencsv.bean.CsvToBean;
import com.opencsv.bean.CsvToBeanBuilder;
import com.propertyintel.listings.model.RawListing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Streams listings from a CSV export of the dataset-items table.
 *
 * Rows are bound lazily, one at a time; the returned stream owns the file
 * handle and must be closed.
 */
@Component
@Slf4j
public class CsvListingReader {

    public Stream<RawListing> read(Path path) {
        log.info("Reading listings from CSV: {}", path);

        BufferedReader reader;
        try {
            reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open listings CSV " + path, e);
        }

        CsvToBean<ListingCsvRow> csv = new CsvToBeanBuilder<ListingCsvRow>(reader)
                .withType(ListingCsvRow.class)
                .withIgnoreLeadingWhiteSpace(true)
                .withIgnoreEmptyLine(true)
                .build();

        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(csv.iterator(), Spliterator.ORDERED), false)
                .map(ListingCsvRow::toRawListing)
                .onClose(() -> closeQuietly(reader, path));
    }

    static void closeQuietly(Reader reader, Path path) {
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", path, e.getMessage());
        }
    }
}
