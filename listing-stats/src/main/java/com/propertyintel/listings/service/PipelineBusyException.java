package com.propertyintel.listings.service;

/**
 * A run was requested while another one is still in progress.
 */
public class PipelineBusyException extends RuntimeException {

    public PipelineBusyException(String message) {
        super(message);
    }
}
