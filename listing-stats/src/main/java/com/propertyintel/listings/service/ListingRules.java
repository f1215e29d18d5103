package com.propertyintel.listings.service;

import com.propertyintel.listings.config.FilterProperties;
import com.propertyintel.listings.model.JoinedListing;
import com.propertyintel.listings.model.NormalizedListing;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Factories for the listing validation rules.
 *
 * A rule that needs a value which is null or not numeric rejects the listing.
 */
public final class ListingRules {

    private static final Pattern ALL_DIGITS = Pattern.compile("^[0-9]+$");

    private ListingRules() {
    }

    /** The full rule set in evaluation order, driven by the given bounds */
    public static List<ListingRule> standard(FilterProperties filter) {
        return List.of(
                propertyType(filter.getPropertyTypes()),
                offerType(filter.getOfferTypes()),
                livingArea(filter.getLivingArea()),
                positivePrice(),
                locationPresent(),
                coordinatesInBounds(filter.getLatitude(), filter.getLongitude()),
                districtNotNumeric(),
                pricePerArea(filter.getPricePerArea()));
    }

    public static ListingRule propertyType(Set<String> allowed) {
        Set<String> types = Set.copyOf(allowed);
        return ListingRule.of("property-type",
                l -> l.getPropertyType() != null && types.contains(l.getPropertyType()));
    }

    public static ListingRule offerType(Set<String> allowed) {
        Set<String> types = Set.copyOf(allowed);
        return ListingRule.of("offer-type",
                l -> l.getOfferType() != null && types.contains(l.getOfferType()));
    }

    public static ListingRule livingArea(FilterProperties.Range bounds) {
        FilterProperties.Range range = copy(bounds);
        return ListingRule.of("living-area", l -> {
            Double area = l.getListing().getLivingArea();
            return area != null && range.contains(area);
        });
    }

    public static ListingRule positivePrice() {
        return ListingRule.of("positive-price", l -> {
            Double price = l.getListing().getPriceTotal();
            return price != null && price > 0;
        });
    }

    /** Usable coordinates, or at least a district to place the listing */
    public static ListingRule locationPresent() {
        return ListingRule.of("location-present", l -> {
            NormalizedListing n = l.getListing();
            boolean hasCoordinates = n.getLatitude() != null && n.getLongitude() != null;
            return hasCoordinates || !ValueCoercion.isMissing(n.getRaw().getDistrict());
        });
    }

    /** Only applies when both coordinates were supplied; then they must be numeric and in range */
    public static ListingRule coordinatesInBounds(FilterProperties.Range latitude,
                                                  FilterProperties.Range longitude) {
        FilterProperties.Range lat = copy(latitude);
        FilterProperties.Range lon = copy(longitude);
        return ListingRule.of("coordinates-in-bounds", l -> {
            NormalizedListing n = l.getListing();
            boolean supplied = !ValueCoercion.isMissing(n.getRaw().getLatitude())
                    && !ValueCoercion.isMissing(n.getRaw().getLongitude());
            if (!supplied) return true;
            return n.getLatitude() != null && n.getLongitude() != null
                    && lat.contains(n.getLatitude())
                    && lon.contains(n.getLongitude());
        });
    }

    /** A bare number in the district field is a leaked code, not a place */
    public static ListingRule districtNotNumeric() {
        return ListingRule.of("district-not-numeric", l -> {
            String district = l.getListing().getRaw().getDistrict();
            return district == null || !ALL_DIGITS.matcher(district).matches();
        });
    }

    /**
     * Checks min * area <= price <= max * area on the decimal values as
     * written, so a quotient that lands exactly on a bound is accepted.
     */
    public static ListingRule pricePerArea(Map<String, FilterProperties.Range> byOfferType) {
        Map<String, FilterProperties.Range> ranges = Map.copyOf(byOfferType);
        return ListingRule.of("price-per-area", l -> {
            if (l.getOfferType() == null) return false;
            FilterProperties.Range range = ranges.get(l.getOfferType());
            if (range == null) return false;

            BigDecimal price = ValueCoercion.toDecimal(l.getListing().getRaw().getPriceTotal());
            BigDecimal area = ValueCoercion.toDecimal(l.getListing().getRaw().getLivingArea());
            if (price == null || area == null || area.signum() <= 0) return false;

            return BigDecimal.valueOf(range.getMin()).multiply(area).compareTo(price) <= 0
                    && BigDecimal.valueOf(range.getMax()).multiply(area).compareTo(price) >= 0;
        });
    }

    private static FilterProperties.Range copy(FilterProperties.Range range) {
        return new FilterProperties.Range(range.getMin(), range.getMax());
    }

    static boolean accepts(List<ListingRule> rules, JoinedListing listing) {
        return rules.stream().allMatch(rule -> rule.test(listing));
    }
}
