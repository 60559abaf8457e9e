package com.example.knowledgesync.repository;

/**
 * Raised when the tracker store cannot be read or written
 * (connectivity, constraint violations, transaction failures).
 */
public class TrackerStoreException extends RuntimeException {

    public TrackerStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
