package com.pulsefocus.backend.exception;

import java.util.List;

/** Vendor client credentials are absent from this deployment. */
public class OuraNotConfiguredException extends OuraException {

    private final List<String> missing;

    public OuraNotConfiguredException(List<String> missing) {
        super("Oura is not configured on this deployment (missing " + String.join(", ", missing) + ")");
        this.missing = List.copyOf(missing);
    }

    public List<String> getMissing() {
        return missing;
    }
}
