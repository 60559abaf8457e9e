package com.example.knowledgesync.client.external;

import com.example.knowledgesync.client.SourceAdapter;
import com.example.knowledgesync.client.SourceFetchException;
import com.example.knowledgesync.config.SyncProperties;
import com.example.knowledgesync.dto.JiraIssueDto;
import com.example.knowledgesync.dto.SourceQuery;
import com.example.knowledgesync.dto.SyncItem;
import com.example.knowledgesync.entity.SourceType;
import com.example.knowledgesync.metrics.SyncMetrics;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Source adapter for Jira issues (REST API v2 search).
 *
 * One bounded request per run: issues of the configured project updated within the lookback
 * window, newest first. Once retries are exhausted or the circuit is open the fetch falls
 * back to an empty list, so an unreachable Jira degrades to "nothing from Jira" instead of failing the run.
 */
@Component
@Slf4j
public class JiraClient implements SourceAdapter {

    private static final String SEARCH_FIELDS = "summary,description,status,updated";

    private final WebClient atlassianWebClient;
    private final SyncProperties properties;
    private final SyncMetrics syncMetrics;

    public JiraClient(@Qualifier("atlassianWebClient") WebClient atlassianWebClient,
                      SyncProperties properties,
                      SyncMetrics syncMetrics) {
        this.atlassianWebClient = atlassianWebClient;
        this.properties = properties;
        this.syncMetrics = syncMetrics;
    }

    @Override
    public SourceType type() {
        return SourceType.JIRA;
    }

    @Override
    public Optional<SourceQuery> configuredQuery() {
        String projectKey = properties.getJira().getProjectKey();
        if (projectKey == null || projectKey.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(SourceQuery.builder()
                .scope(projectKey)
                .lookback(properties.getJira().getLookback())
                .maxResults(properties.getFetch().getMaxResults())
                .build());
    }

    @Override
    // Retry wraps the circuit breaker, so only the outer layer may fall back
    @Retry(name = "jiraRetry", fallbackMethod = "fetchFallback")
    @CircuitBreaker(name = "jiraCircuitBreaker")
    public List<SyncItem> fetch(SourceQuery query) {
        log.info("Fetching Jira issues for project={}", query.getScope());

        String jql = buildJql(query);

        try {
            JiraIssueDto.SearchResponse response = atlassianWebClient.get()
                    .uri(baseUrl() + "/rest/api/2/search?jql={jql}&maxResults={maxResults}&fields={fields}",
                            jql, query.getMaxResults(), SEARCH_FIELDS)
                    .headers(headers -> headers.setBasicAuth(
                            properties.getAtlassian().getEmail(),
                            properties.getAtlassian().getApiToken()))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, clientResponse -> {
                        if (clientResponse.statusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                            log.warn("Jira rate limit exceeded (429)");
                            return Mono.error(new RateLimitExceededException("Jira rate limit exceeded"));
                        } else if (clientResponse.statusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
                            log.error("Jira authentication failed (401)");
                            return Mono.error(new AuthenticationException("Jira API token invalid"));
                        }
                        return clientResponse.createException();
                    })
                    .bodyToMono(JiraIssueDto.SearchResponse.class)
                    .timeout(properties.getFetch().getTimeout())
                    .block();

            if (response == null || response.getIssues() == null || response.getIssues().isEmpty()) {
                log.info("No issues found for project={}", query.getScope());
                return List.of();
            }

            List<SyncItem> items = response.getIssues().stream()
                    .map(this::toSyncItem)
                    .filter(Objects::nonNull)
                    .toList();
            log.info("Fetched {} issues from Jira project={}", items.size(), query.getScope());
            return items;

        } catch (RateLimitExceededException | AuthenticationException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error fetching Jira issues for project={}: {}", query.getScope(), e.getMessage());
            throw new SourceFetchException(SourceType.JIRA, "Failed to fetch Jira issues: " + e.getMessage(), e);
        }
    }

    /**
     * Relative JQL date in minutes, e.g. updated >= '-43200m' for a 30 day lookback.
     */
    String buildJql(SourceQuery query) {
        return String.format("project = '%s' AND updated >= '-%dm' ORDER BY updated DESC",
                query.getScope(), query.getLookback().toMinutes());
    }

    private SyncItem toSyncItem(JiraIssueDto issue) {
        JiraIssueDto.Fields fields = issue.getFields();
        if (fields == null || fields.getUpdated() == null) {
            log.warn("Skipping Jira issue {} without updated timestamp", issue.getKey());
            return null;
        }

        String description = fields.getDescription() == null || fields.getDescription().isBlank()
                ? "None"
                : fields.getDescription();
        String status = fields.getStatus() != null ? fields.getStatus().getName() : "Unknown";

        return SyncItem.builder()
                .id(issue.getKey())
                .type(SourceType.JIRA)
                .updatedAt(fields.getUpdated())
                .content("Title: " + fields.getSummary()
                        + "\n\nDescription: " + description
                        + "\n\nStatus: " + status)
                .build();
    }

    /**
     * Called when retries are exhausted or the circuit is open.
     */
    private List<SyncItem> fetchFallback(SourceQuery query, Throwable throwable) {
        log.warn("Jira unavailable for project={}, continuing without Jira items: {}",
                query.getScope(), throwable.getMessage());
        syncMetrics.recordSourceFallback(SourceType.JIRA);
        return List.of();
    }

    private String baseUrl() {
        String url = properties.getAtlassian().getUrl();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static class RateLimitExceededException extends SourceFetchException {
        public RateLimitExceededException(String message) {
            super(SourceType.JIRA, message, null);
        }
    }

    public static class AuthenticationException extends SourceFetchException {
        public AuthenticationException(String message) {
            super(SourceType.JIRA, message, null);
        }
    }
}
