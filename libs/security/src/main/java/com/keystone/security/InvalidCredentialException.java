package com.keystone.security;

/**
 * Thrown when a presented credential is malformed, expired, wrongly signed, or issued for another
 * issuer or audience.
 */
public class InvalidCredentialException extends RuntimeException {

    public InvalidCredentialException(String message) {
        super(message);
    }

    public InvalidCredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
