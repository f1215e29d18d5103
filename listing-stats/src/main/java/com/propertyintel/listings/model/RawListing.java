package com.propertyintel.listings.model;

import lombok.Builder;
import lombok.Value;

/**
 * One listing exactly as delivered by a listing source.
 *
 * Every field is kept as raw text. Sources disagree on types (CSV exports are
 * all strings, Apify JSON mixes numbers and strings) so coercion is left to
 * the normaliser.
 */
@Value
@Builder
public class RawListing {

    /** Listing identifier, the deduplication key */
    String id;

    /** Creation timestamp, usually ISO-8601 */
    String createdAt;

    /** sale | rent (anything else is filtered out later) */
    String offerType;

    /** apartment | house | land | ... */
    String propertyType;

    String priceTotal;

    /** Usable living area in m² */
    String livingArea;

    String district;

    String latitude;

    String longitude;
}
