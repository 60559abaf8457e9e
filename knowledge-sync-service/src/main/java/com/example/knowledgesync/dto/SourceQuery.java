package com.example.knowledgesync.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Query parameters for a single bounded fetch from one source.
 *
 * scope is the Jira project key or the Confluence space key.
 * maxResults caps the page; sources are never paginated beyond it.
 */
@Value
@Builder
public class SourceQuery {

    String scope;
    Duration lookback;
    int maxResults;
}
