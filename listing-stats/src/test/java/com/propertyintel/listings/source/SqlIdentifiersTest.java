package com.propertyintel.listings.source;

import com.propertyintel.listings.config.InvalidPipelineConfigException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
public class SqlIdentifiersTest {

    @Test void testAcceptsPlainAndQuotedNames() {
        assertEquals("uzemi", SqlIdentifiers.requireTableName("uzemi", "t"));
        assertEquals("property_intel.dataset_items",
                SqlIdentifiers.requireTableName("property_intel.dataset_items", "t"));
        assertEquals("\"in.c-apify\".\"dataset-items\"",
                SqlIdentifiers.requireTableName("\"in.c-apify\".\"dataset-items\"", "t"));
    }

    @Test void testRejectsInjection() {
        assertThrows(InvalidPipelineConfigException.class,
                () -> SqlIdentifiers.requireTableName("uzemi; DROP TABLE uzemi", "t"));
        assertThrows(InvalidPipelineConfigException.class,
                () -> SqlIdentifiers.requireTableName("\"a\"\" OR 1=1", "t"));
        assertThrows(InvalidPipelineConfigException.class,
                () -> SqlIdentifiers.requireTableName(null, "t"));
    }
}
