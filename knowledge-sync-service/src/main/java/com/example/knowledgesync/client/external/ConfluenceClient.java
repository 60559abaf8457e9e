package com.example.knowledgesync.client.external;

import com.example.knowledgesync.client.SourceAdapter;
import com.example.knowledgesync.client.SourceFetchException;
import com.example.knowledgesync.config.SyncProperties;
import com.example.knowledgesync.dto.ConfluencePageDto;
import com.example.knowledgesync.dto.SourceQuery;
import com.example.knowledgesync.dto.SyncItem;
import com.example.knowledgesync.entity.SourceType;
import com.example.knowledgesync.metrics.SyncMetrics;
import com.example.knowledgesync.service.UpdateTimestamp;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Source adapter for Confluence pages of one space.
 *
 * Fetches a single page of results with version and storage body expanded, keeps the pages
 * modified within the lookback window and publishes their text with the markup stripped.
 */
@Component
@Slf4j
public class ConfluenceClient implements SourceAdapter {

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final WebClient atlassianWebClient;
    private final SyncProperties properties;
    private final SyncMetrics syncMetrics;

    public ConfluenceClient(@Qualifier("atlassianWebClient") WebClient atlassianWebClient,
                            SyncProperties properties,
                            SyncMetrics syncMetrics) {
        this.atlassianWebClient = atlassianWebClient;
        this.properties = properties;
        this.syncMetrics = syncMetrics;
    }

    @Override
    public SourceType type() {
        return SourceType.CONFLUENCE;
    }

    /**
     * Confluence is optional: no space key (or a template value) disables it.
     */
    @Override
    public Optional<SourceQuery> configuredQuery() {
        String spaceKey = properties.getConfluence().getSpaceKey();
        if (spaceKey == null || spaceKey.isBlank() || properties.getValidation().isPlaceholder(spaceKey)) {
            return Optional.empty();
        }
        return Optional.of(SourceQuery.builder()
                .scope(spaceKey)
                .lookback(properties.getConfluence().getLookback())
                .maxResults(properties.getFetch().getMaxResults())
                .build());
    }

    @Override
    // Retry wraps the circuit breaker, so only the outer layer may fall back
    @Retry(name = "confluenceRetry", fallbackMethod = "fetchFallback")
    @CircuitBreaker(name = "confluenceCircuitBreaker")
    public List<SyncItem> fetch(SourceQuery query) {
        log.info("Fetching Confluence pages for space={}", query.getScope());

        try {
            ConfluencePageDto.PageResponse response = atlassianWebClient.get()
                    .uri(baseUrl() + "/rest/api/content?spaceKey={space}&type=page&start=0&limit={limit}&expand={expand}",
                            query.getScope(), query.getMaxResults(), "version,body.storage")
                    .headers(headers -> headers.setBasicAuth(
                            properties.getAtlassian().getEmail(),
                            properties.getAtlassian().getApiToken()))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(ConfluencePageDto.PageResponse.class)
                    .timeout(properties.getFetch().getTimeout())
                    .block();

            if (response == null || response.getResults() == null || response.getResults().isEmpty()) {
                log.info("No pages found in space={}", query.getScope());
                return List.of();
            }

            LocalDateTime cutoff = LocalDateTime.now().minus(query.getLookback());
            List<SyncItem> items = response.getResults().stream()
                    .filter(page -> isModifiedSince(page, cutoff))
                    .map(this::toSyncItem)
                    .toList();

            log.info("Fetched {} recently updated pages from Confluence space={} ({} listed)",
                    items.size(), query.getScope(), response.getResults().size());
            return items;

        } catch (Exception e) {
            log.error("Error fetching Confluence pages for space={}: {}", query.getScope(), e.getMessage());
            throw new SourceFetchException(SourceType.CONFLUENCE,
                    "Failed to fetch Confluence pages: " + e.getMessage(), e);
        }
    }

    /**
     * Compares wall-clock values: the page offset is dropped, as the cutoff is local time.
     */
    private boolean isModifiedSince(ConfluencePageDto page, LocalDateTime cutoff) {
        String when = page.getVersion() != null ? page.getVersion().getWhen() : null;
        Optional<UpdateTimestamp> modified = UpdateTimestamp.tryParse(when);
        if (modified.isEmpty()) {
            log.warn("Skipping Confluence page {} with unparsable version timestamp '{}'", page.getId(), when);
            return false;
        }
        return !modified.get().toLocalDateTime().isBefore(cutoff);
    }

    private SyncItem toSyncItem(ConfluencePageDto page) {
        String html = page.getBody() != null && page.getBody().getStorage() != null
                ? page.getBody().getStorage().getValue()
                : null;

        return SyncItem.builder()
                .id(page.getId())
                .type(SourceType.CONFLUENCE)
                .updatedAt(page.getVersion().getWhen())
                .content("Title: " + page.getTitle() + "\n\nContent: " + toPlainText(html))
                .build();
    }

    String toPlainText(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String text = HTML_TAG.matcher(html).replaceAll(" ");
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();

        int maxLength = properties.getConfluence().getMaxContentLength();
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }

    private List<SyncItem> fetchFallback(SourceQuery query, Throwable throwable) {
        log.warn("Confluence unavailable for space={}, continuing without Confluence pages: {}",
                query.getScope(), throwable.getMessage());
        syncMetrics.recordSourceFallback(SourceType.CONFLUENCE);
        return List.of();
    }

    private String baseUrl() {
        String url = properties.getAtlassian().getUrl();
        if (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        String contextPath = properties.getConfluence().getContextPath();
        return contextPath == null ? url : url + contextPath;
    }
}
