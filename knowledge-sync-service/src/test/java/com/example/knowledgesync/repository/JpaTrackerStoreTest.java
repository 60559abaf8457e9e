package com.example.knowledgesync.repository;

import com.example.knowledgesync.entity.SourceType;
import com.example.knowledgesync.entity.SyncStatus;
import com.example.knowledgesync.entity.SyncTracker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaTrackerStore.class)
class JpaTrackerStoreTest {

    @Autowired
    private TrackerStore trackerStore;

    @Autowired
    private SyncTrackerRepository repository;

    @Test
    void unknownItemHasNoRecord() {
        assertThat(trackerStore.get("PROJ-404")).isEmpty();
    }

    @Test
    void firstUpsertInsertsRow() {
        Instant before = Instant.now();

        trackerStore.upsert("PROJ-1", SourceType.JIRA, "2024-01-01T10:00:00.000+0000", "doc-1", SyncStatus.SUCCESS);

        SyncTracker row = trackerStore.get("PROJ-1").orElseThrow();
        assertThat(row.getSourceType()).isEqualTo(SourceType.JIRA);
        assertThat(row.getLastSyncedUpdateTime()).isEqualTo("2024-01-01T10:00:00.000+0000");
        assertThat(row.getDestinationDocId()).isEqualTo("doc-1");
        assertThat(row.getLastSyncStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(row.getLastSyncedAt()).isAfterOrEqualTo(before);
    }

    @Test
    void secondUpsertOverwritesInPlace() {
        trackerStore.upsert("98301", SourceType.CONFLUENCE, "2024-01-01T10:00:00Z", "doc-1", SyncStatus.SUCCESS);
        trackerStore.upsert("98301", SourceType.CONFLUENCE, null, "", SyncStatus.FAILED);

        assertThat(repository.count()).isEqualTo(1);
        SyncTracker row = trackerStore.get("98301").orElseThrow();
        assertThat(row.getLastSyncStatus()).isEqualTo(SyncStatus.FAILED);
        assertThat(row.getLastSyncedUpdateTime()).isNull();
        assertThat(row.getDestinationDocId()).isEmpty();
    }

    @Test
    void repeatedIdenticalUpsertIsIdempotent() {
        for (int i = 0; i < 3; i++) {
            trackerStore.upsert("PROJ-2", SourceType.JIRA, "2024-01-01T10:00:00Z", "doc-2", SyncStatus.SUCCESS);
        }

        assertThat(repository.count()).isEqualTo(1);
        assertThat(trackerStore.get("PROJ-2")).get()
                .extracting(SyncTracker::getDestinationDocId)
                .isEqualTo("doc-2");
    }
}
