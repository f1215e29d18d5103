package com.propertyintel.listings.service;

import com.propertyintel.listings.model.RawListing;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Keeps one listing per id.
 *
 * The first row seen for an id wins. Which duplicate that is depends only on
 * source order, not on timestamps or completeness, so repeated runs over the
 * same export pick the same rows.
 */
@Component
public class ListingDeduplicator {

    public Stream<RawListing> deduplicate(Stream<RawListing> listings) {
        Set<String> seen = new HashSet<>();
        // null ids form a single partition, like any other id
        return listings.filter(listing -> seen.add(listing.getId()));
    }
}
