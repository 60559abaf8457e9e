package com.example.knowledgesync.service;

import com.example.knowledgesync.dto.SyncItem;
import com.example.knowledgesync.entity.SourceType;
import com.example.knowledgesync.entity.SyncStatus;
import com.example.knowledgesync.entity.SyncTracker;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChangeDetectorTest {

    private final ChangeDetector changeDetector = new ChangeDetector();

    @Test
    void untrackedItemIsAlwaysSynced() {
        assertThat(changeDetector.shouldSync(item("2024-01-01T10:00:00Z"), Optional.empty())).isTrue();
    }

    @Nested
    class SameOffsetKind {

        @Test
        void equalTimestampIsNotNewer() {
            assertThat(changeDetector.shouldSync(
                    item("2024-01-01T10:00:00+00:00"), tracked("2024-01-01T10:00:00+00:00"))).isFalse();
        }

        @Test
        void oneSecondLaterIsNewer() {
            assertThat(changeDetector.shouldSync(
                    item("2024-01-01T10:00:01+00:00"), tracked("2024-01-01T10:00:00+00:00"))).isTrue();
        }

        @Test
        void olderRemoteIsNotSynced() {
            assertThat(changeDetector.shouldSync(
                    item("2024-01-01T09:59:59+00:00"), tracked("2024-01-01T10:00:00+00:00"))).isFalse();
        }

        @Test
        void differentOffsetsCompareAsInstants() {
            assertThat(changeDetector.shouldSync(
                    item("2024-01-01T18:00:00+08:00"), tracked("2024-01-01T10:00:00Z"))).isFalse();
            assertThat(changeDetector.shouldSync(
                    item("2024-01-01T18:00:01+08:00"), tracked("2024-01-01T10:00:00Z"))).isTrue();
        }

        @Test
        void jiraCompactOffsetIsUnderstood() {
            assertThat(changeDetector.shouldSync(
                    item("2024-01-01T10:00:00.000+0000"), tracked("2024-01-01T10:00:00.000+0000"))).isFalse();
            assertThat(changeDetector.shouldSync(
                    item("2024-01-01T10:00:00.000+0000"), tracked("2024-01-01T09:00:00Z"))).isTrue();
        }

        @Test
        void naiveValuesCompareAsWallClock() {
            assertThat(changeDetector.shouldSync(
                    item("2024-01-01 10:00:00"), tracked("2024-01-01T10:00:00"))).isFalse();
            assertThat(changeDetector.shouldSync(
                    item("2024-01-01 10:00:01"), tracked("2024-01-01T10:00:00"))).isTrue();
        }
    }

    @Nested
    class MixedOffsetKinds {

        @Test
        void remoteOffsetIsDroppedAgainstNaiveStoredValue() {
            assertThat(changeDetector.shouldSync(
                    item("2024-01-01T10:00:00+00:00"), tracked("2024-01-01T09:00:00"))).isTrue();
        }

        @Test
        void equalAfterDroppingOffsetIsNotNewer() {
            assertThat(changeDetector.shouldSync(
                    item("2024-01-01T10:00:00+00:00"), tracked("2024-01-01T10:00:00"))).isFalse();
        }

        @Test
        void oneSecondAfterDroppingOffsetIsNewer() {
            assertThat(changeDetector.shouldSync(
                    item("2024-01-01T10:00:01+00:00"), tracked("2024-01-01T10:00:00"))).isTrue();
        }

        @Test
        void storedOffsetIsDroppedAgainstNaiveRemoteValue() {
            // 10:00+08:00 is 02:00Z, but only wall-clock values are compared here
            assertThat(changeDetector.shouldSync(
                    item("2024-01-01T09:00:00"), tracked("2024-01-01T10:00:00+08:00"))).isFalse();
        }
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"not-a-date", "2024-13-45T99:00:00", "yesterday"})
    void unusableStoredTimestampForcesResync(String stored) {
        assertThat(changeDetector.shouldSync(item("2024-01-01T10:00:00Z"), tracked(stored))).isTrue();
    }

    @Test
    void unparsableRemoteTimestampIsRejectedOnlyWhenTracked() {
        assertThatThrownBy(() -> changeDetector.shouldSync(item("garbage"), tracked("2024-01-01T10:00:00Z")))
                .isInstanceOf(DateTimeParseException.class);
        assertThat(changeDetector.shouldSync(item("garbage"), Optional.empty())).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"2024/01/01 10:00", "01.01.2024"})
    void untrackedItemSyncsWhateverItsTimestampFormat(String remote) {
        assertThat(changeDetector.shouldSync(item(remote), Optional.empty())).isTrue();
    }

    private static SyncItem item(String updatedAt) {
        return SyncItem.builder()
                .id("PROJ-1")
                .type(SourceType.JIRA)
                .updatedAt(updatedAt)
                .content("Title: test")
                .build();
    }

    private static Optional<SyncTracker> tracked(String lastSyncedUpdateTime) {
        return Optional.of(SyncTracker.builder()
                .sourceId("PROJ-1")
                .sourceType(SourceType.JIRA)
                .lastSyncedUpdateTime(lastSyncedUpdateTime)
                .destinationDocId("doc-1")
                .lastSyncStatus(SyncStatus.SUCCESS)
                .lastSyncedAt(Instant.now())
                .build());
    }
}
