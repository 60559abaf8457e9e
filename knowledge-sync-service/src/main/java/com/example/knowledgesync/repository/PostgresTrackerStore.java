package com.example.knowledgesync.repository;

import com.example.knowledgesync.entity.SourceType;
import com.example.knowledgesync.entity.SyncStatus;
import com.example.knowledgesync.entity.SyncTracker;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * PostgreSQL tracker store using native INSERT ... ON CONFLICT.
 * Single statement per write, so concurrent writers for the same id cannot hit the primary key.
 */
@Repository
@Slf4j
@ConditionalOnProperty(name = "sync.tracker.backend", havingValue = "postgres")
public class PostgresTrackerStore implements TrackerStore {

    private static final String UPSERT_SQL = """
            INSERT INTO sync_tracker (
                source_id, source_type, last_synced_update_time,
                destination_doc_id, last_sync_status, last_synced_at
            ) VALUES (
                :sourceId, :sourceType, CAST(:updatedAt AS VARCHAR(64)),
                :destinationDocId, :status, :syncedAt
            )
            ON CONFLICT (source_id)
            DO UPDATE SET
                source_type = EXCLUDED.source_type,
                last_synced_update_time = EXCLUDED.last_synced_update_time,
                destination_doc_id = EXCLUDED.destination_doc_id,
                last_sync_status = EXCLUDED.last_sync_status,
                last_synced_at = EXCLUDED.last_synced_at
            """;

    private final SyncTrackerRepository repository;
    private final TransactionTemplate transactionTemplate;

    @PersistenceContext
    private EntityManager entityManager;

    public PostgresTrackerStore(SyncTrackerRepository repository, PlatformTransactionManager transactionManager) {
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
            Integer affected = transactionTemplate.execute(tx -> {
                Query query = entityManager.createNativeQuery(UPSERT_SQL);
                query.setParameter("sourceId", sourceId);
                query.setParameter("sourceType", sourceType.name());
                query.setParameter("updatedAt", updatedAt);
                query.setParameter("destinationDocId", destinationDocId);
                query.setParameter("status", status.name());
                query.setParameter("syncedAt", Timestamp.from(Instant.now()));
                int rows = query.executeUpdate();

                // Keep the persistence context from serving a stale row on the next get()
                entityManager.clear();
                return rows;
            });
            log.debug("Upserted tracker record sourceId={}, status={}, affected={}", sourceId, status, affected);
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            throw new TrackerStoreException("Failed to write tracker record for " + sourceId, e);
        }
    }
}
