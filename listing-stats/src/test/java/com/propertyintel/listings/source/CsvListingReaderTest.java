package com.propertyintel.listings.source;

import com.propertyintel.listings.model.RawListing;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class CsvListingReaderTest {

    @TempDir
    Path tempDir;

    private final CsvListingReader reader = new CsvListingReader();

    @Test void testReadsExportColumnsByName() throws IOException {
        Path csv = tempDir.resolve("dataset-items.csv");
        Files.writeString(csv, String.join("\n",
                "data_district,id,createdAt,data_offerType,data_type,data_priceTotal,data_livingArea,data_gpsCoord_lat,data_gpsCoord_lon,data_city",
                "\"Hlavní město Praha\",a1,2025-03-01T10:00:00Z,sale,apartment,8500000,72.5,50.08,14.42,Praha",
                "\"Ostrava - město\",a2,2025-03-02T10:00:00Z,rent,house,.,,,,Ostrava",
                ""), StandardCharsets.UTF_8);

        List<RawListing> listings;
        try (Stream<RawListing> stream = reader.read(csv)) {
            listings = stream.toList();
        }

        assertEquals(2, listings.size());
        RawListing first = listings.get(0);
        assertEquals("a1", first.getId());
        assertEquals("Hlavní město Praha", first.getDistrict());
        assertEquals("sale", first.getOfferType());
        assertEquals("apartment", first.getPropertyType());
        assertEquals("8500000", first.getPriceTotal());
        assertEquals("72.5", first.getLivingArea());
        assertEquals("50.08", first.getLatitude());
        assertEquals("14.42", first.getLongitude());

        RawListing second = listings.get(1);
        assertEquals(".", second.getPriceTotal());
        assertTrue(second.getLivingArea() == null || second.getLivingArea().isEmpty());
    }

    @Test void testMissingFileFails() {
        assertThrows(UncheckedIOException.class, () -> reader.read(tempDir.resolve("missing.csv")));
    }
}
