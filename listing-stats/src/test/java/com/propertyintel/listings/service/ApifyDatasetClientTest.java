package com.propertyintel.listings.service;

import com.propertyintel.listings.config.ListingStatsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@Tag("unit")
public class ApifyDatasetClientTest {

    private static final String ITEMS_URL =
            "https://api.apify.com/v2/datasets/ds-1/items?format=json&clean=true&token=secret";

    private MockRestServiceServer server;
    private ApifyDatasetClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        ListingStatsProperties properties = new ListingStatsProperties();
        properties.getSource().getListings().getApify().setDatasetId("ds-1");
        properties.getSource().getListings().getApify().setToken("secret");
        client = new ApifyDatasetClient(restTemplate, properties);
    }

    @Test void testDownloadsBodyToTempFile() throws IOException {
        String body = "[{\"id\":\"a1\"}]";
        server.expect(requestTo(ITEMS_URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        Path file = client.downloadItems();
        try {
            assertEquals(body, Files.readString(file, StandardCharsets.UTF_8));
        } finally {
            Files.deleteIfExists(file);
        }
        server.verify();
    }

    @Test void testServerErrorPropagates() {
        server.expect(requestTo(ITEMS_URL)).andRespond(withServerError());

        assertThrows(HttpServerErrorException.class, () -> client.downloadItems());
        server.verify();
    }
}
