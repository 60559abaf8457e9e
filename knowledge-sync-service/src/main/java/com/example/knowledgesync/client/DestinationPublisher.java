package com.example.knowledgesync.client;

import java.util.Optional;

/**
 * Destination index that receives the published documents.
 */
public interface DestinationPublisher {

    /**
     * @param name    Document name (the source item id)
     * @param content Document text
     * @return destination document id, or empty when the destination rejected the document
     */
    Optional<String> publish(String name, String content);
}
