package com.propertyintel.listings.service;

import com.propertyintel.listings.model.JoinedListing;
import com.propertyintel.listings.model.NormalizedListing;
import org.springframework.stereotype.Component;

/**
 * Left join of listings onto the region lookup. Listings whose district is
 * unknown keep a null region instead of being dropped.
 */
@Component
public class RegionJoiner {

    public JoinedListing join(NormalizedListing listing, RegionLookup lookup) {
        var match = lookup.find(listing.getDistrictKey());

        return JoinedListing.builder()
                .listing(listing)
                .districtLabel(match.map(RegionLookup.RegionEntry::districtLabel).orElse(null))
                .region(match.map(RegionLookup.RegionEntry::regionLabel).orElse(null))
                .pricePerArea(pricePerArea(listing.getPriceTotal(), listing.getLivingArea()))
                .build();
    }

    static Double pricePerArea(Double priceTotal, Double livingArea) {
        if (priceTotal == null || livingArea == null || livingArea == 0.0) return null;
        return priceTotal / livingArea;
    }
}
