package com.keystone.persistence;

/**
 * The persistence layer could not complete an operation. Distinct from every access denial: the
 * system could not decide, rather than decided no.
 */
public class UnavailableException extends RuntimeException {

    public UnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
