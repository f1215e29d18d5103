package com.propertyintel.listings.source;

import com.propertyintel.listings.config.InvalidPipelineConfigException;
import com.propertyintel.listings.config.ListingStatsProperties;
import com.propertyintel.listings.model.RawListing;
import com.propertyintel.listings.model.RegionReference;
import com.propertyintel.listings.service.ApifyDatasetClient;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Stream;

/**
 * Picks the listing and region readers based on configuration.
 * Supports CSV, APIFY_JSON, APIFY_API and JDBC listings; CSV and JDBC regions.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InputRouter {

    private final CsvListingReader csvListingReader;
    private final ApifyJsonListingReader apifyJsonListingReader;
    private final JdbcListingReader jdbcListingReader;
    private final ApifyDatasetClient apifyDatasetClient;
    private final CsvRegionReader csvRegionReader;
    private final JdbcRegionReader jdbcRegionReader;
    private final ListingStatsProperties properties;

    /**
     * Fails start-up on source settings that could never work.
     */
    @PostConstruct
    public void validateConfiguration() {
        ListingStatsProperties.Source.Listings listings = properties.getSource().getListings();
        switch (listings.getType()) {
            case CSV, APIFY_JSON -> requirePath(listings.getPath(), "source.listings.path");
            case JDBC -> SqlIdentifiers.requireTableName(listings.getTable(), "source.listings.table");
            case APIFY_API -> {
                String datasetId = listings.getApify().getDatasetId();
                if (datasetId == null || datasetId.isBlank()) {
                    throw new InvalidPipelineConfigException("source.listings.apify.dataset-id is required for APIFY_API");
                }
            }
        }

        ListingStatsProperties.Source.Regions regions = properties.getSource().getRegions();
        switch (regions.getType()) {
            case CSV -> requirePath(regions.getPath(), "source.regions.path");
            case JDBC -> SqlIdentifiers.requireTableName(regions.getTable(), "source.regions.table");
        }
    }

    /**
     * Open the configured listings source. The caller must close the stream.
     */
    public Stream<RawListing> openListings() {
        ListingStatsProperties.Source.Listings listings = properties.getSource().getListings();

        return switch (listings.getType()) {
            case CSV -> csvListingReader.read(Paths.get(listings.getPath()));
            case APIFY_JSON -> apifyJsonListingReader.read(Paths.get(listings.getPath()));
            case JDBC -> jdbcListingReader.read(listings.getTable());
            case APIFY_API -> readDownload(apifyDatasetClient.downloadItems());
        };
    }

    public List<RegionReference> loadRegions() {
        ListingStatsProperties.Source.Regions regions = properties.getSource().getRegions();

        return switch (regions.getType()) {
            case CSV -> csvRegionReader.read(Paths.get(regions.getPath()));
            case JDBC -> jdbcRegionReader.read(regions.getTable());
        };
    }

    private void requirePath(String path, String property) {
        if (path == null || path.isBlank()) {
            throw new InvalidPipelineConfigException(property + " is required");
        }
    }

    /**
     * The downloaded file is deleted when the stream closes, or right away if
     * it cannot be opened.
     */
    private Stream<RawListing> readDownload(Path download) {
        try {
            return apifyJsonListingReader.read(download).onClose(() -> deleteDownload(download));
        } catch (RuntimeException e) {
            deleteDownload(download);
            throw e;
        }
    }

    private void deleteDownload(Path download) {
        try {
            Files.deleteIfExists(download);
        } catch (IOException e) {
            log.warn("Could not delete downloaded dataset {}: {}", download, e.getMessage());
        }
    }
}
