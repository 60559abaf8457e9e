package com.example.knowledgesync.entity;

/**
 * Kind of knowledge source an item was fetched from.
 * Stored as VARCHAR, so adding a constant needs no schema migration.
 */
public enum SourceType {
    JIRA,
    CONFLUENCE
}
