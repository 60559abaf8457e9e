package com.example.knowledgesync.exception;

/**
 * A sync was requested while another run is still in flight.
 */
public class SyncInProgressException extends RuntimeException {

    public SyncInProgressException(String message) {
        super(message);
    }
}
