package com.pulsefocus.backend.exception;

/** Vendor answered 429. */
public class RateLimitedException extends VendorUnavailableException {

    public RateLimitedException(String path) {
        super("Oura rate limited request to " + path, 429);
    }
}
