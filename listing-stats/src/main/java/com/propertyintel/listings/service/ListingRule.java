package com.propertyintel.listings.service;

import com.propertyintel.listings.model.JoinedListing;

import java.util.function.Predicate;

/**
 * A named validation rule. A listing survives the filter chain only when
 * every rule accepts it. Rules must not depend on each other.
 */
public interface ListingRule extends Predicate<JoinedListing> {

    String name();

    static ListingRule of(String name, Predicate<JoinedListing> condition) {
        return new ListingRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean test(JoinedListing listing) {
                return condition.test(listing);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
