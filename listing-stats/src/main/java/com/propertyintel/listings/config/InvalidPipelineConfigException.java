package com.propertyintel.listings.config;

/**
 * Thrown while the pipeline is being wired when its configuration cannot
 * produce a valid run. Always raised before any listing is read.
 */
public class InvalidPipelineConfigException extends RuntimeException {

    public InvalidPipelineConfigException(String message) {
        super(message);
    }
}
