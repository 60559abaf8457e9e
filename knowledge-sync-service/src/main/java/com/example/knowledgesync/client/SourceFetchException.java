package com.example.knowledgesync.client;

import com.example.knowledgesync.entity.SourceType;
import lombok.Getter;

/**
 * A source could not be read (connectivity, authentication, malformed response).
 */
@Getter
public class SourceFetchException extends RuntimeException {

    private final SourceType sourceType;

    public SourceFetchException(SourceType sourceType, String message, Throwable cause) {
        super(message, cause);
        this.sourceType = sourceType;
    }
}
