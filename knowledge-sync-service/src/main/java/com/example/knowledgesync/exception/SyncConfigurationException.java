package com.example.knowledgesync.exception;

import lombok.Getter;

import java.util.List;

/**
 * Required settings are missing or still hold template values.
 * Raised before any source is contacted.
 */
@Getter
public class SyncConfigurationException extends RuntimeException {

    private final List<String> missing;
    private final List<String> placeholders;

    public SyncConfigurationException(String message, List<String> missing, List<String> placeholders) {
        super(message);
        this.missing = List.copyOf(missing);
        this.placeholders = List.copyOf(placeholders);
    }
}
