package com.pulsefocus.backend.exception;

public class TelemetryValidationException extends OuraException {

    public TelemetryValidationException(String message) {
        super(message);
    }
}
