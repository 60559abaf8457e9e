package com.example.knowledgesync.client.external;

import com.example.knowledgesync.client.DestinationPublisher;
import com.example.knowledgesync.config.SyncProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Publishes documents into a Dify dataset (knowledge base).
 *
 * Tries document/create_by_text first; deployments that do not expose it (404/405)
 * get the same text uploaded as a .txt file through document/create_by_file.
 * No retry here: a timed-out create may still have been indexed, and retrying would duplicate it.
 */
@Component
@Slf4j
public class DifyClient implements DestinationPublisher {

    static final String UPLOADED_WITHOUT_ID = "uploaded_without_id";

    private static final Duration PUBLISH_TIMEOUT = Duration.ofSeconds(60);

    private final WebClient difyWebClient;
    private final SyncProperties properties;
    private final ObjectMapper objectMapper;

    public DifyClient(@Qualifier("difyWebClient") WebClient difyWebClient,
                      SyncProperties properties,
                      ObjectMapper objectMapper) {
        this.difyWebClient = difyWebClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    @CircuitBreaker(name = "difyCircuitBreaker", fallbackMethod = "publishFallback")
    public Optional<String> publish(String name, String content) {
        SyncProperties.Dify dify = properties.getDify();
        if (isBlank(dify.getApiUrl()) || isBlank(dify.getApiKey()) || isBlank(dify.getDatasetId())) {
            log.warn("Dify client not configured, skipping upload of '{}'", name);
            return Optional.empty();
        }

        log.info("Uploading document '{}' to Dify", name);
        Map<String, Object> response;
        try {
            response = createByText(name, content);
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == HttpStatus.NOT_FOUND.value() || status == HttpStatus.METHOD_NOT_ALLOWED.value()) {
                log.info("create_by_text unavailable ({}), retrying '{}' as file upload", status, name);
                response = createByFile(name, content);
            } else {
                throw new DifyClientException("Dify rejected document '" + name + "': "
                        + status + " " + e.getResponseBodyAsString(), e);
            }
        }

        String documentId = extractDocumentId(response);
        if (documentId == null) {
            log.warn("Document '{}' uploaded but Dify returned no id. Response: {}", name, response);
            return Optional.of(UPLOADED_WITHOUT_ID);
        }

        log.info("Document '{}' uploaded, Dify document id={}", name, documentId);
        return Optional.of(documentId);
    }

    private Map<String, Object> createByText(String name, String content) {
        Map<String, Object> body = Map.of(
                "name", name,
                "text", content,
                "indexing_technique", properties.getDify().getIndexingTechnique(),
                "process_rule", Map.of("mode", "automatic"));

        return difyWebClient.post()
                .uri(documentEndpoint("create_by_text"))
                .headers(headers -> headers.setBearerAuth(properties.getDify().getApiKey()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .timeout(PUBLISH_TIMEOUT)
                .block();
    }

    private Map<String, Object> createByFile(String name, String content) {
        MultipartBodyBuilder multipart = new MultipartBodyBuilder();
        multipart.part("file", new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8)))
                .filename(name + ".txt")
                .contentType(MediaType.TEXT_PLAIN);
        multipart.part("data", processRuleJson());

        try {
            return difyWebClient.post()
                    .uri(documentEndpoint("create_by_file"))
                    .headers(headers -> headers.setBearerAuth(properties.getDify().getApiKey()))
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(multipart.build()))
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                    .timeout(PUBLISH_TIMEOUT)
                    .block();
        } catch (WebClientResponseException e) {
            throw new DifyClientException("Dify rejected file upload of '" + name + "': "
                    + e.getStatusCode().value() + " " + e.getResponseBodyAsString(), e);
        }
    }

    private String processRuleJson() {
        try {
            return objectMapper.writeValueAsString(Map.of(
                    "indexing_technique", properties.getDify().getIndexingTechnique(),
                    "process_rule", Map.of("mode", "automatic")));
        } catch (JsonProcessingException e) {
            throw new DifyClientException("Cannot serialize Dify process rule", e);
        }
    }

    /**
     * Dify versions differ in where the id lives: document.id, id or document_id.
     */
    String extractDocumentId(Map<String, Object> response) {
        if (response == null) {
            return null;
        }
        Object document = response.get("document");
        if (document instanceof Map<?, ?> documentMap && documentMap.get("id") != null) {
            return String.valueOf(documentMap.get("id"));
        }
        if (response.get("id") != null) {
            return String.valueOf(response.get("id"));
        }
        if (response.get("document_id") != null) {
            return String.valueOf(response.get("document_id"));
        }
        return null;
    }

    /**
     * Circuit open or upload failed: report "no id" so the item is recorded as FAILED.
     */
    private Optional<String> publishFallback(String name, String content, Throwable throwable) {
        log.error("Upload of '{}' to Dify failed: {}", name, throwable.getMessage());
        return Optional.empty();
    }

    private String documentEndpoint(String operation) {
        String apiUrl = properties.getDify().getApiUrl();
        if (apiUrl.endsWith("/")) {
            apiUrl = apiUrl.substring(0, apiUrl.length() - 1);
        }
        return apiUrl + "/datasets/" + properties.getDify().getDatasetId() + "/document/" + operation;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static class DifyClientException extends RuntimeException {
        public DifyClientException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
