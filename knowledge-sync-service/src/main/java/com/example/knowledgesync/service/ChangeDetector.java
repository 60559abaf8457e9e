package com.example.knowledgesync.service;

import com.example.knowledgesync.dto.SyncItem;
import com.example.knowledgesync.entity.SyncTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether a fetched item has to be (re)published.
 * Pure function of its two inputs; no store or network access.
 */
@Component
@Slf4j
public class ChangeDetector {

    /**
     * @param remote  Item as fetched from the source
     * @param tracked Tracker row for the same id, if any
     * @return true when the item was never seen, the stored timestamp is unusable,
     *         or the remote timestamp is strictly newer than the stored one
     * @throws java.time.format.DateTimeParseException if a tracker row exists and the remote
     *         timestamp is unparsable
     */
    public boolean shouldSync(SyncItem remote, Optional<SyncTracker> tracked) {
        // Untracked items are never parsed, whatever format the source uses
        if (tracked.isEmpty()) {
            log.debug("{} {} not tracked yet, syncing", remote.getType(), remote.getId());
            return true;
        }

        UpdateTimestamp remoteTime = UpdateTimestamp.parse(remote.getUpdatedAt());

        String storedValue = tracked.get().getLastSyncedUpdateTime();
        Optional<UpdateTimestamp> storedTime = UpdateTimestamp.tryParse(storedValue);
        if (storedTime.isEmpty()) {
            log.warn("Stored timestamp '{}' for {} is unparsable, forcing resync", storedValue, remote.getId());
            return true;
        }

        boolean newer = remoteTime.isAfter(storedTime.get());
        if (newer) {
            log.info("Detected update for {} (stored: {}, remote: {})", remote.getId(), storedTime.get(), remoteTime);
        }
        return newer;
    }
}
