package com.propertyintel.listings.service;

import com.propertyintel.listings.model.JoinedListing;
import com.propertyintel.listings.model.RegionReference;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class RegionJoinerTest {

    @Test void testResolvesRegion() {
        JoinedListing joined = ListingFixtures.join(ListingFixtures.validSale().build());

        assertEquals("Jihomoravský kraj", joined.getRegion());
        assertEquals("Brno-město", joined.getDistrictLabel());
        assertEquals(50000.0, joined.getPricePerArea());
    }

    @Test void testReferenceSpellingIsNormalisedToo() {
        // reference row is "Ostrava - město", listing says "Ostrava"
        JoinedListing joined = ListingFixtures.join(
                ListingFixtures.validSale().district("OSTRAVA").build());

        assertEquals("Moravskoslezský kraj", joined.getRegion());
        assertEquals("Ostrava - město", joined.getDistrictLabel());
    }

    @Test void testUnmatchedDistrictKeepsRow() {
        JoinedListing joined = ListingFixtures.join(
                ListingFixtures.validSale().district("Atlantida").build());

        assertNull(joined.getRegion());
        assertNull(joined.getDistrictLabel());
        assertEquals(50000.0, joined.getPricePerArea());
    }

    @Test void testMissingDistrictKeepsRow() {
        JoinedListing joined = ListingFixtures.join(
                ListingFixtures.validSale().district(null).build());
        assertNull(joined.getRegion());
    }

    @Test void testPricePerAreaUndefinedCases() {
        assertNull(RegionJoiner.pricePerArea(null, 60.0));
        assertNull(RegionJoiner.pricePerArea(1000.0, null));
        assertNull(RegionJoiner.pricePerArea(1000.0, 0.0));
        assertEquals(25.0, RegionJoiner.pricePerArea(1000.0, 40.0));
    }

    @Test void testLookupFirstMappingWins() {
        RegionLookup lookup = RegionLookup.of(List.of(
                new RegionReference("Kolín", "Středočeský kraj"),
                new RegionReference("KOLÍN ", "Jiný kraj"),
                new RegionReference(" ", "Prázdný kraj")));

        assertEquals(1, lookup.size());
        assertEquals("Středočeský kraj", lookup.find("kolín").orElseThrow().regionLabel());
        assertTrue(lookup.find(null).isEmpty());
    }
}
