package com.example.knowledgesync.repository;

import com.example.knowledgesync.entity.SourceType;
import com.example.knowledgesync.entity.SyncStatus;
import com.example.knowledgesync.entity.SyncTracker;

import java.util.Optional;

/**
 * Durable per-item sync state.
 *
 * One implementation per storage backend, chosen at startup by {@code sync.tracker.backend};
 * callers never depend on which one is active.
 */
public interface TrackerStore {

    /**
     * Look up the tracker row for a source item.
     *
     * @param sourceId Source item id (Jira issue key, Confluence page id)
     * @return the row, or empty when the item was never attempted
     * @throws TrackerStoreException if the store cannot be read
     */
    Optional<SyncTracker> get(String sourceId);

    /**
     * Insert the row if absent, otherwise overwrite it in place.
     * lastSyncedAt is always set to the current time by the store.
     *
     * @param sourceId         Source item id (primary key)
     * @param sourceType       Source kind
     * @param updatedAt        Remote timestamp to record, may be null
     * @param destinationDocId Destination document id, empty on failure
     * @param status           Outcome of the attempt
     * @throws TrackerStoreException if the write fails
     */
    void upsert(String sourceId, SourceType sourceType, String updatedAt, String destinationDocId, SyncStatus status);
}
