package com.propertyintel.listings.model;

/**
 * One row of the administrative reference table: a district and the region
 * that contains it.
 */
public record RegionReference(String district, String region) {}
