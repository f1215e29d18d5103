package com.propertyintel.listings.service;

import com.propertyintel.listings.model.AggregateRow;
import com.propertyintel.listings.model.JoinedListing;
import com.propertyintel.listings.model.OfferTypeSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Mean and median price per m² by (year, region, offer type, property type),
 * plus a country-wide summary per offer type.
 *
 * Region labels are grouped case-insensitively and reported upper-cased.
 * Listings without a usable year or price per m² cannot be placed in a group
 * and are skipped.
 */
@Component
@Slf4j
public class PriceStatsAggregator {

    static final Comparator<GroupKey> OUTPUT_ORDER = Comparator
            .comparingInt(GroupKey::year)
            .thenComparing(GroupKey::region, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(GroupKey::offerType, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(GroupKey::propertyType, Comparator.nullsFirst(Comparator.naturalOrder()));

    record GroupKey(int year, String region, String offerType, String propertyType) {}

    public AggregationResult aggregate(Stream<JoinedListing> listings) {
        Map<GroupKey, PriceAccumulator> groups = new HashMap<>();
        Map<String, PriceAccumulator> byOfferType = new TreeMap<>();
        long[] aggregated = {0};
        long[] withoutYear = {0};
        long[] withoutPrice = {0};

        listings.forEach(listing -> {
            Integer year = listing.getYear();
            Double price = listing.getPricePerArea();
            if (year == null) {
                withoutYear[0]++;
                return;
            }
            if (price == null) {
                withoutPrice[0]++;
                return;
            }
            GroupKey key = new GroupKey(year, displayRegion(listing.getRegion()),
                    listing.getOfferType(), listing.getPropertyType());
            groups.computeIfAbsent(key, k -> new PriceAccumulator()).add(price);
            if (listing.getOfferType() != null) {
                byOfferType.computeIfAbsent(listing.getOfferType(), k -> new PriceAccumulator()).add(price);
            }
            aggregated[0]++;
        });

        List<AggregateRow> rows = new ArrayList<>(groups.size());
        groups.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(OUTPUT_ORDER))
                .forEach(e -> rows.add(toRow(e.getKey(), e.getValue())));

        List<OfferTypeSummary> summaries = new ArrayList<>(byOfferType.size());
        byOfferType.forEach((offerType, acc) -> summaries.add(OfferTypeSummary.builder()
                .offerType(offerType)
                .minPricePerArea(acc.min())
                .maxPricePerArea(acc.max())
                .meanPricePerArea(acc.mean())
                .rowCount(acc.count())
                .build()));

        if (withoutYear[0] > 0 || withoutPrice[0] > 0) {
            log.warn("Listings skipped during aggregation: {} without year, {} without price per m²",
                    withoutYear[0], withoutPrice[0]);
        }
        log.info("Aggregated {} listings into {} groups", aggregated[0], rows.size());

        return new AggregationResult(List.copyOf(rows), List.copyOf(summaries), aggregated[0],
                withoutYear[0], withoutPrice[0]);
    }

    static String displayRegion(String region) {
        return region == null ? null : region.toUpperCase(Locale.ROOT);
    }

    private AggregateRow toRow(GroupKey key, PriceAccumulator acc) {
        return AggregateRow.builder()
                .year(key.year())
                .region(key.region())
                .offerType(key.offerType())
                .propertyType(key.propertyType())
                .meanPricePerArea(acc.mean())
                .medianPricePerArea(acc.median())
                .rowCount(acc.count())
                .build();
    }
}
