package com.propertyintel.listings.service;

import com.propertyintel.listings.config.ListingStatsProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Downloads a finished Apify dataset to a local file.
 *
 * The dataset is materialised by the actor run beforehand; this only copies
 * the snapshot. The body is streamed straight to disk and parsed afterwards
 * by {@link com.propertyintel.listings.source.ApifyJsonListingReader}.
 * Transient failures are retried by Resilience4j (instance "apifyApi").
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ApifyDatasetClient {

    private final RestTemplate restTemplate;
    private final ListingStatsProperties properties;

    /**
     * @return path of a temp file holding the dataset items as a JSON array;
     *         the caller deletes it when done
     */
    @Retry(name = "apifyApi")
    public Path downloadItems() {
        ListingStatsProperties.Source.Apify apify = properties.getSource().getListings().getApify();

        UriComponentsBuilder uri = UriComponentsBuilder
                .fromHttpUrl(apify.getBaseUrl() + "/datasets/" + apify.getDatasetId() + "/items")
                .queryParam("format", "json")
                .queryParam("clean", true);
        if (apify.getToken() != null && !apify.getToken().isBlank()) {
            uri.queryParam("token", apify.getToken());
        }

        Path target;
        try {
            target = Files.createTempFile("apify-dataset-", ".json");
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create temp file for dataset download", e);
        }

        log.info("Downloading Apify dataset {} to {}", apify.getDatasetId(), target);
        Long bytes;
        try {
            bytes = restTemplate.execute(uri.build().toUri(), HttpMethod.GET, null, response -> {
                try (InputStream body = response.getBody()) {
                    return Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
                }
            });
        } catch (RuntimeException e) {
            log.error("Apify dataset {} download failed: {}", apify.getDatasetId(), e.getMessage());
            deleteQuietly(target);
            throw e; // let Resilience4j retry
        }

        log.info("Apify dataset {} downloaded ({} bytes)", apify.getDatasetId(), bytes);
        return target;
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete partial download {}: {}", file, e.getMessage());
        }
    }
}
