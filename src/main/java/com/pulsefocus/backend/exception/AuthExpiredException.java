package com.pulsefocus.backend.exception;

/**
 * The stored credential can no longer produce an access token. Callers revoke
 * the credential so the user is asked to reconnect.
 */
public class AuthExpiredException extends OuraException {

    public AuthExpiredException(String message) {
        super(message);
    }
}
