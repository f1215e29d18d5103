package com.propertyintel.listings.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "listing-stats")
@Data
public class ListingStatsProperties {

    private Source source = new Source();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Source {
        private Listings listings = new Listings();
        private Regions regions = new Regions();

        @Data
        public static class Listings {
            private ListingSourceType type = ListingSourceType.CSV;
            private String path = "/data/input/dataset-items.csv";
            private String table = "dataset_items";
            private Apify apify = new Apify();
        }

        @Data
        public static class Regions {
            private RegionSourceType type = RegionSourceType.CSV;
            private String path = "/data/input/uzemi.csv";
            private String table = "uzemi";
        }

        @Data
        public static class Apify {
            private String baseUrl = "https://api.apify.com/v2";
            private String datasetId;
            private String token;
        }

        public enum ListingSourceType {
            CSV, APIFY_JSON, APIFY_API, JDBC
        }

        public enum RegionSourceType {
            CSV, JDBC
        }
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.CSV;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            CLICKHOUSE, CSV, BOTH
        }
    }

    @Data
    public static class Scheduling {
        /** "-" disables the scheduled run */
        private String cron = "-";
        private boolean runOnStartup = false;
    }
}
