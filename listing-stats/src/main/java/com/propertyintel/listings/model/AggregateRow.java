package com.propertyintel.listings.model;

import lombok.Builder;
import lombok.Value;

/**
 * Price-per-m² statistics for one (year, region, offer type, property type) group.
 *
 * region is the upper-cased display label, null for listings whose district
 * did not resolve to a region.
 */
@Value
@Builder
public class AggregateRow {

    int year;
    String region;
    String offerType;
    String propertyType;
    double meanPricePerArea;
    double medianPricePerArea;
    long rowCount;
}
