package com.propertyintel.listings.model;

import lombok.Builder;
import lombok.Value;

/**
 * Country-wide price-per-m² range and average for one offer type.
 */
@Value
@Builder
public class OfferTypeSummary {

    String offerType;
    double minPricePerArea;
    double maxPricePerArea;
    double meanPricePerArea;
    long rowCount;
}
