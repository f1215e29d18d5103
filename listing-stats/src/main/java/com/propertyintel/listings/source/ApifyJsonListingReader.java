package com.propertyintel.listings.source;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.listings.model.ApifyDatasetItem;
import com.propertyintel.listings.model.RawListing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Streams listings from an Apify dataset export.
 *
 * Accepts both the JSON array format and newline-delimited JSON; items are
 * bound one at a time so multi-GB exports are never held in memory.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ApifyJsonListingReader {

    private final ObjectMapper objectMapper;

    public Stream<RawListing> read(Path path) {
        log.info("Reading listings from Apify JSON: {}", path);

        MappingIterator<ApifyDatasetItem> items;
        try {
            items = objectMapper.readerFor(ApifyDatasetItem.class).readValues(path.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open Apify dataset file " + path, e);
        }

        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(items, Spliterator.ORDERED), false)
                .map(ApifyJsonListingReader::toRawListing)
                .onClose(() -> {
                    try {
                        items.close();
                    } catch (IOException e) {
                        log.warn("Failed to close {}: {}", path, e.getMessage());
                    }
                });
    }

    static RawListing toRawListing(ApifyDatasetItem item) {
        RawListing.RawListingBuilder builder = RawListing.builder()
                .id(item.getId())
                .createdAt(item.getCreatedAt());

        ApifyDatasetItem.Listing data = item.getData();
        if (data != null) {
            builder.offerType(data.getOfferType())
                    .propertyType(data.getType())
                    .priceTotal(data.getPriceTotal())
                    .livingArea(data.getLivingArea())
                    .district(data.getDistrict());
            if (data.getGpsCoord() != null) {
                builder.latitude(data.getGpsCoord().getLat())
                        .longitude(data.getGpsCoord().getLon());
            }
        }
        return builder.build();
    }
}
