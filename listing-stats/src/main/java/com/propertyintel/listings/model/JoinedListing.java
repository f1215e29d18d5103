package com.propertyintel.listings.model;

import lombok.Builder;
import lombok.Value;

/**
 * A normalised listing enriched with its administrative region and the
 * derived price per m².
 */
@Value
@Builder
public class JoinedListing {

    NormalizedListing listing;

    /** Canonical district name from the region reference, null when unmatched */
    String districtLabel;

    /** Region (kraj) name, null when the district could not be resolved */
    String region;

    /** priceTotal / livingArea, null if either is missing or the area is zero */
    Double pricePerArea;

    public Integer getYear() {
        return listing.getYear();
    }

    public String getOfferType() {
        return listing.getOfferType();
    }

    public String getPropertyType() {
        return listing.getPropertyType();
    }
}
