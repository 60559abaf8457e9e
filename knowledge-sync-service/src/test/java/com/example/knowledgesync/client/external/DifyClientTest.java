package com.example.knowledgesync.client.external;

import com.example.knowledgesync.config.SyncProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DifyClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private SyncProperties properties;
    private DifyClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        properties = new SyncProperties();
        properties.getDify().setApiUrl(server.url("/v1").toString());
        properties.getDify().setApiKey("dataset-abc123");
        properties.getDify().setDatasetId("ds-42");

        client = new DifyClient(WebClient.create(), properties, objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void createByTextReturnsDocumentId() throws Exception {
        server.enqueue(json(200, "{\"document\": {\"id\": \"doc-7f3a\", \"name\": \"PROJ-1\"}, \"batch\": \"b1\"}"));

        Optional<String> documentId = client.publish("PROJ-1", "Title: Login page times out");

        assertThat(documentId).contains("doc-7f3a");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/v1/datasets/ds-42/document/create_by_text");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer dataset-abc123");

        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.get("name").asText()).isEqualTo("PROJ-1");
        assertThat(body.get("text").asText()).isEqualTo("Title: Login page times out");
        assertThat(body.get("indexing_technique").asText()).isEqualTo("high_quality");
        assertThat(body.get("process_rule").get("mode").asText()).isEqualTo("automatic");
    }

    @Test
    void fallsBackToFileUploadWhenTextEndpointIsMissing() throws Exception {
        server.enqueue(json(404, "{\"code\": \"not_found\"}"));
        server.enqueue(json(200, "{\"id\": \"doc-file-1\"}"));

        Optional<String> documentId = client.publish("98301", "Title: Onboarding guide");

        assertThat(documentId).contains("doc-file-1");
        assertThat(server.getRequestCount()).isEqualTo(2);

        server.takeRequest();
        RecordedRequest upload = server.takeRequest();
        assertThat(upload.getPath()).isEqualTo("/v1/datasets/ds-42/document/create_by_file");
        assertThat(upload.getHeader("Content-Type")).startsWith("multipart/form-data");
        String multipart = upload.getBody().readUtf8();
        assertThat(multipart)
                .contains("filename=\"98301.txt\"")
                .contains("Title: Onboarding guide")
                .contains("name=\"data\"");
    }

    @Test
    void methodNotAllowedAlsoTriggersFileUpload() {
        server.enqueue(json(405, "{}"));
        server.enqueue(json(200, "{\"document_id\": \"doc-legacy\"}"));

        assertThat(client.publish("PROJ-9", "text")).contains("doc-legacy");
    }

    @Test
    void successWithoutIdIsStillASuccess() {
        server.enqueue(json(200, "{\"batch\": \"20240101\"}"));

        assertThat(client.publish("PROJ-1", "text")).contains(DifyClient.UPLOADED_WITHOUT_ID);
    }

    @Test
    void otherErrorsAreRaised() {
        server.enqueue(json(400, "{\"code\": \"invalid_param\"}"));

        assertThatThrownBy(() -> client.publish("PROJ-1", "text"))
                .isInstanceOf(DifyClient.DifyClientException.class)
                .hasMessageContaining("400");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void unconfiguredClientPublishesNothing() {
        properties.getDify().setDatasetId("");

        assertThat(client.publish("PROJ-1", "text")).isEmpty();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void documentIdLookupOrder() {
        assertThat(client.extractDocumentId(Map.of("document", Map.of("id", "a"), "id", "b"))).isEqualTo("a");
        assertThat(client.extractDocumentId(Map.of("id", "b", "document_id", "c"))).isEqualTo("b");
        assertThat(client.extractDocumentId(Map.of("document_id", "c"))).isEqualTo("c");
        assertThat(client.extractDocumentId(Map.of())).isNull();
        assertThat(client.extractDocumentId(null)).isNull();
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
                .setResponseCode(status)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }
}
