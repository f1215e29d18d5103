package com.propertyintel.listings.model;

import lombok.Builder;
import lombok.Value;

/**
 * A deduplicated listing with cleaned and coerced fields.
 *
 * Any field that could not be derived is null. The raw row is kept so that
 * validation rules can still tell "missing" apart from "present but garbage".
 */
@Value
@Builder
public class NormalizedListing {

    RawListing raw;

    /** Calendar year of createdAt, null when the timestamp is unparseable */
    Integer year;

    /** District text after the fixed exception table was applied */
    String district;

    /** Lowercased, whitespace-collapsed district used only for the region join */
    String districtKey;

    Double priceTotal;

    Double livingArea;

    Double latitude;

    Double longitude;

    public String getId() {
        return raw.getId();
    }

    public String getOfferType() {
        return raw.getOfferType();
    }

    public String getPropertyType() {
        return raw.getPropertyType();
    }
}
