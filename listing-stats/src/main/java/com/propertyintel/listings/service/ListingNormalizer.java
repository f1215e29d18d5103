package com.propertyintel.listings.service;

import com.propertyintel.listings.model.NormalizedListing;
import com.propertyintel.listings.model.RawListing;
import org.springframework.stereotype.Component;

/**
 * Derives cleaned fields from a raw listing. Never throws; anything that
 * cannot be derived is left null for the validation rules to reject.
 */
@Component
public class ListingNormalizer {

    public NormalizedListing normalize(RawListing raw) {
        String district = DistrictNames.applyExceptions(raw.getDistrict());

        return NormalizedListing.builder()
                .raw(raw)
                .year(ValueCoercion.yearOf(raw.getCreatedAt()))
                .district(district)
                .districtKey(DistrictNames.normalizeKey(district))
                .priceTotal(ValueCoercion.toDouble(raw.getPriceTotal()))
                .livingArea(ValueCoercion.toDouble(raw.getLivingArea()))
                .latitude(ValueCoercion.toDouble(raw.getLatitude()))
                .longitude(ValueCoercion.toDouble(raw.getLongitude()))
                .build();
    }
}
