package com.pulsefocus.backend.exception;

/**
 * Base type for failures in the wearable integration. Messages are written
 * for logs and never include token values.
 */
public class OuraException extends RuntimeException {

    public OuraException(String message) {
        super(message);
    }

    public OuraException(String message, Throwable cause) {
        super(message, cause);
    }
}
