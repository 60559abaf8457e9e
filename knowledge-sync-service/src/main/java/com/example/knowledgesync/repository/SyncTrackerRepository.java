package com.example.knowledgesync.repository;

import com.example.knowledgesync.entity.SyncTracker;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data repository for sync_tracker rows, keyed by source id.
 */
@Repository
public interface SyncTrackerRepository extends JpaRepository<SyncTracker, String> {
}
