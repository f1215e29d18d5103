package com.propertyintel.listings.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Raw DTO matching one item of the Apify real-estate dataset.
 * Kept separate from the domain model to isolate the scraper's JSON layout.
 *
 * Scalar fields are bound as text: the scraper writes numbers as JSON
 * numbers, quoted strings or "" depending on the portal.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApifyDatasetItem {

    private String id;

    private String createdAt;

    private Listing data;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Listing {
        private String offerType;
        private String type;
        private String priceTotal;
        private String livingArea;
        private String district;
        private GpsCoord gpsCoord;

        @Data
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class GpsCoord {
            private String lat;
            private String lon;
        }
    }
}
