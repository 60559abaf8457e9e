package com.example.knowledgesync.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Durable sync state for one source item.
 * One row per source id, overwritten in place on every sync attempt and never deleted.
 *
 * lastSyncedUpdateTime keeps the remote timestamp exactly as the source reported it
 * (with or without offset), so change detection can reproduce the original comparison.
 */
@Entity
@Table(name = "sync_tracker", indexes = {
        @Index(name = "idx_sync_tracker_source_type", columnList = "source_type"),
        @Index(name = "idx_sync_tracker_status", columnList = "last_sync_status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncTracker {

    @Id
    @Column(name = "source_id", nullable = false, length = 255)
    private String sourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, length = 50)
    private SourceType sourceType;

    @Column(name = "last_synced_update_time", length = 64)
    private String lastSyncedUpdateTime;

    @Column(name = "destination_doc_id", length = 255)
    private String destinationDocId;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_sync_status", nullable = false, length = 20)
    private SyncStatus lastSyncStatus;

    @Column(name = "last_synced_at", nullable = false)
    private Instant lastSyncedAt;
}
