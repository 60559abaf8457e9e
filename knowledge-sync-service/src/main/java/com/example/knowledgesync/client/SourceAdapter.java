package com.example.knowledgesync.client;

import com.example.knowledgesync.dto.SourceQuery;
import com.example.knowledgesync.dto.SyncItem;
import com.example.knowledgesync.entity.SourceType;

import java.util.List;
import java.util.Optional;

/**
 * A knowledge source the orchestrator pulls candidate items from.
 */
public interface SourceAdapter {

    SourceType type();

    /**
     * Query built from configuration, or empty when this source is not configured
     * and must be skipped.
     */
    Optional<SourceQuery> configuredQuery();

    /**
     * Single bounded fetch, at most {@code query.getMaxResults()} items, no pagination.
     * "No results" is an empty list. Connectivity or auth failures degrade to an empty
     * list as well; implementations log them and may throw {@link SourceFetchException}
     * only when no fallback is wired around them.
     */
    List<SyncItem> fetch(SourceQuery query);
}
