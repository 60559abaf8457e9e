package com.example.knowledgesync.entity;

/**
 * Outcome of the last publish attempt for a tracked item.
 */
public enum SyncStatus {
    SUCCESS,
    FAILED
}
