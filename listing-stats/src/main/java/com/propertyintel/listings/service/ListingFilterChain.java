package com.propertyintel.listings.service;

import com.propertyintel.listings.config.FilterProperties;
import com.propertyintel.listings.model.JoinedListing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Predicate;

/**
 * The configured set of validation rules.
 *
 * Bounds are validated here, so a bad configuration fails application
 * start-up instead of a run.
 */
@Component
@Slf4j
public class ListingFilterChain implements Predicate<JoinedListing> {

    private final List<ListingRule> rules;

    public ListingFilterChain(FilterProperties filter) {
        filter.validate();
        this.rules = ListingRules.standard(filter);
        log.info("Filter chain: {} (price per m² {})", rules, filter.getPricePerArea());
    }

    @Override
    public boolean test(JoinedListing listing) {
        return ListingRules.accepts(rules, listing);
    }

    /**
     * Name of the first rule (in chain order) that rejects the listing, or null
     * if it passes every rule. Used for rejection counts only.
     */
    public String firstFailingRule(JoinedListing listing) {
        for (ListingRule rule : rules) {
            if (!rule.test(listing)) {
                return rule.name();
            }
        }
        return null;
    }

    public List<ListingRule> rules() {
        return rules;
    }
}
