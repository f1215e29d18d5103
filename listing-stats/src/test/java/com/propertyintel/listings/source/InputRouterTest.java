package com.propertyintel.listings.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.listings.config.InvalidPipelineConfigException;
import com.propertyintel.listings.config.ListingStatsProperties;
import com.propertyintel.listings.config.ListingStatsProperties.Source.ListingSourceType;
import com.propertyintel.listings.config.ListingStatsProperties.Source.RegionSourceType;
import com.propertyintel.listings.model.RawListing;
import com.propertyintel.listings.service.ApifyDatasetClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
public class InputRouterTest {

    @TempDir
    Path tempDir;

    private CsvListingReader csvListingReader;
    private ApifyJsonListingReader apifyJsonListingReader;
    private JdbcListingReader jdbcListingReader;
    private ApifyDatasetClient apifyDatasetClient;
    private JdbcRegionReader jdbcRegionReader;
    private ListingStatsProperties properties;
    private InputRouter router;

    @BeforeEach
    void setUp() {
        csvListingReader = mock(CsvListingReader.class);
        apifyJsonListingReader = mock(ApifyJsonListingReader.class);
        jdbcListingReader = mock(JdbcListingReader.class);
        apifyDatasetClient = mock(ApifyDatasetClient.class);
        jdbcRegionReader = mock(JdbcRegionReader.class);
        properties = new ListingStatsProperties();
        router = new InputRouter(csvListingReader, apifyJsonListingReader, jdbcListingReader,
                apifyDatasetClient, mock(CsvRegionReader.class), jdbcRegionReader, properties);
    }

    @Test void testDefaultsAreValid() {
        assertDoesNotThrow(() -> router.validateConfiguration());
    }

    @Test void testInvalidTableNameFailsValidation() {
        properties.getSource().getListings().setType(ListingSourceType.JDBC);
        properties.getSource().getListings().setTable("items; DELETE FROM items");

        assertThrows(InvalidPipelineConfigException.class, () -> router.validateConfiguration());
    }

    @Test void testApifyApiNeedsDatasetId() {
        properties.getSource().getListings().setType(ListingSourceType.APIFY_API);

        assertThrows(InvalidPipelineConfigException.class, () -> router.validateConfiguration());
    }

    @Test void testCsvListingsDelegateToCsvReader() {
        properties.getSource().getListings().setPath("/data/in/items.csv");
        when(csvListingReader.read(Paths.get("/data/in/items.csv"))).thenReturn(Stream.empty());

        try (Stream<RawListing> listings = router.openListings()) {
            assertEquals(0, listings.count());
        }
        verify(csvListingReader).read(Paths.get("/data/in/items.csv"));
    }

    @Test void testJdbcRegionsDelegateToJdbcReader() {
        properties.getSource().getRegions().setType(RegionSourceType.JDBC);
        properties.getSource().getRegions().setTable("uzemi");
        when(jdbcRegionReader.read("uzemi")).thenReturn(List.of());

        assertEquals(List.of(), router.loadRegions());
    }

    @Test void testApifyDownloadIsDeletedAfterReading() throws IOException {
        properties.getSource().getListings().setType(ListingSourceType.APIFY_API);
        Path download = Files.createFile(tempDir.resolve("apify-dataset.json"));
        when(apifyDatasetClient.downloadItems()).thenReturn(download);
        when(apifyJsonListingReader.read(download)).thenReturn(Stream.empty());

        try (Stream<RawListing> listings = router.openListings()) {
            listings.count();
        }

        assertFalse(Files.exists(download));
    }

    @Test void testApifyDownloadIsDeletedWhenUnreadable() throws IOException {
        properties.getSource().getListings().setType(ListingSourceType.APIFY_API);
        Path download = Files.writeString(tempDir.resolve("apify-dataset.json"),
                "<html>503 Service Unavailable</html>", StandardCharsets.UTF_8);
        when(apifyDatasetClient.downloadItems()).thenReturn(download);
        InputRouter jsonRouter = new InputRouter(csvListingReader, new ApifyJsonListingReader(new ObjectMapper()),
                jdbcListingReader, apifyDatasetClient, mock(CsvRegionReader.class), jdbcRegionReader, properties);

        assertThrows(UncheckedIOException.class, jsonRouter::openListings);
        assertFalse(Files.exists(download));
    }
}
