package com.propertyintel.listings.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tunable bounds for the listing validation rules.
 *
 * Defaults describe residential listings in the Czech Republic: the
 * coordinate box is an approximate bounding box of the country and the
 * price-per-m² ranges are in CZK.
 */
@Component
@ConfigurationProperties(prefix = "listing-stats.filter")
@Data
public class FilterProperties {

    private Set<String> propertyTypes = new LinkedHashSet<>(List.of("apartment", "house"));
    private Set<String> offerTypes = new LinkedHashSet<>(List.of("sale", "rent"));

    private Range livingArea = new Range(16, 500);
    private Range latitude = new Range(48.5, 51.1);
    private Range longitude = new Range(12.0, 18.9);

    /** Accepted price per m², keyed by offer type */
    private Map<String, Range> pricePerArea = new LinkedHashMap<>(Map.of(
            "rent", new Range(50, 1500),
            "sale", new Range(5000, 300000)));

    /**
     * Check that the configuration can drive a filter chain.
     *
     * @throws InvalidPipelineConfigException describing the first problem found
     */
    public void validate() {
        if (propertyTypes == null || propertyTypes.isEmpty()) {
            throw new InvalidPipelineConfigException("filter.property-types must not be empty");
        }
        if (offerTypes == null || offerTypes.isEmpty()) {
            throw new InvalidPipelineConfigException("filter.offer-types must not be empty");
        }
        checkRange("filter.living-area", livingArea);
        checkRange("filter.latitude", latitude);
        checkRange("filter.longitude", longitude);

        if (pricePerArea == null) {
            throw new InvalidPipelineConfigException("filter.price-per-area must be configured");
        }
        for (String offerType : offerTypes) {
            Range range = pricePerArea.get(offerType);
            if (range == null) {
                throw new InvalidPipelineConfigException(
                        "filter.price-per-area has no range for offer type '" + offerType + "'");
            }
            checkRange("filter.price-per-area." + offerType, range);
        }
    }

    private void checkRange(String name, Range range) {
        if (range == null) {
            throw new InvalidPipelineConfigException(name + " must be configured");
        }
        if (!Double.isFinite(range.getMin()) || !Double.isFinite(range.getMax())) {
            throw new InvalidPipelineConfigException(name + " bounds must be finite numbers");
        }
        if (range.getMin() > range.getMax()) {
            throw new InvalidPipelineConfigException(
                    name + " min " + range.getMin() + " is greater than max " + range.getMax());
        }
    }

    /** Closed interval [min, max] */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Range {
        private double min;
        private double max;

        public boolean contains(double value) {
            return value >= min && value <= max;
        }
    }
}
