package com.pulsefocus.backend.exception;

/**
 * A vendor request failed. {@code status} is the HTTP status when the vendor
 * answered, or 0 for network failures and timeouts.
 */
public class VendorUnavailableException extends OuraException {

    private final int status;

    public VendorUnavailableException(String message, int status) {
        super(message);
        this.status = status;
    }

    public VendorUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    public int getStatus() {
        return status;
    }
}
