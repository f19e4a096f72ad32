package com.keystone.persistence;

/** Raised by a {@link RecordStore} that cannot reach or use its backing storage. */
public class RecordStoreException extends RuntimeException {

    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
