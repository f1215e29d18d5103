package com.propertyintel.listings.config;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class FilterPropertiesTest {

    @Test void testDefaultsAreValid() {
        assertDoesNotThrow(() -> new FilterProperties().validate());
    }

    @Test void testInvertedRangeIsRejected() {
        FilterProperties filter = new FilterProperties();
        filter.setLivingArea(new FilterProperties.Range(500, 16));

        assertThrows(InvalidPipelineConfigException.class, filter::validate);
    }

    @Test void testNonFiniteBoundIsRejected() {
        FilterProperties filter = new FilterProperties();
        filter.setLatitude(new FilterProperties.Range(Double.NaN, 51.1));

        assertThrows(InvalidPipelineConfigException.class, filter::validate);
    }

    @Test void testEmptyTypeSetIsRejected() {
        FilterProperties filter = new FilterProperties();
        filter.setPropertyTypes(Set.of());

        assertThrows(InvalidPipelineConfigException.class, filter::validate);
    }

    @Test void testOfferTypeWithoutPriceRangeIsRejected() {
        FilterProperties filter = new FilterProperties();
        filter.setOfferTypes(new LinkedHashSet<>(List.of("sale", "rent", "auction")));

        assertThrows(InvalidPipelineConfigException.class, filter::validate);
    }

    @Test void testRangeIsClosed() {
        FilterProperties.Range range = new FilterProperties.Range(16, 500);

        assertTrue(range.contains(16));
        assertTrue(range.contains(500));
        assertFalse(range.contains(15.99));
        assertFalse(range.contains(500.01));
    }
}
