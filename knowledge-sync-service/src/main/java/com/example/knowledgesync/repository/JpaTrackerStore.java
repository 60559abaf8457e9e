package com.example.knowledgesync.repository;

import com.example.knowledgesync.entity.SourceType;
import com.example.knowledgesync.entity.SyncStatus;
import com.example.knowledgesync.entity.SyncTracker;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Optional;

/**
 * Portable tracker store: read-modify-write through Spring Data inside one short transaction.
 * Works on any JPA-supported database (H2, MySQL, PostgreSQL...).
 */
@Repository
@Slf4j
@ConditionalOnProperty(name = "sync.tracker.backend", havingValue = "jpa", matchIfMissing = true)
public class JpaTrackerStore implements TrackerStore {

    private final SyncTrackerRepository repository;
    private final TransactionTemplate transactionTemplate;

    public JpaTrackerStore(SyncTrackerRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Optional<SyncTracker> get(String sourceId) {
        try {
            return repository.findById(sourceId);
        } catch (DataAccessException | PersistenceException e) {
            throw new TrackerStoreException("Failed to read tracker record for " + sourceId, e);
        }
    }

    @Override
    public void upsert(String sourceId, SourceType sourceType, String updatedAt,
                       String destinationDocId, SyncStatus status) {
        try {
            transactionTemplate.executeWithoutResult(tx -> {
                SyncTracker tracker = repository.findById(sourceId)
                        .orElseGet(() -> SyncTracker.builder().sourceId(sourceId).build());

                tracker.setSourceType(sourceType);
                tracker.setLastSyncedUpdateTime(updatedAt);
                tracker.setDestinationDocId(destinationDocId);
                tracker.setLastSyncStatus(status);
                tracker.setLastSyncedAt(Instant.now());

                repository.saveAndFlush(tracker);
            });
            log.debug("Upserted tracker record sourceId={}, status={}", sourceId, status);
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            throw new TrackerStoreException("Failed to write tracker record for " + sourceId, e);
        }
    }
}
