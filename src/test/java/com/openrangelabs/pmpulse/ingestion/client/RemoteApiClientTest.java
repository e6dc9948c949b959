package com.openrangelabs.pmpulse.ingestion.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.pmpulse.ingestion.config.IngestionProperties;
import com.openrangelabs.pmpulse.ingestion.entity.ApiConnection;
import com.openrangelabs.pmpulse.ingestion.exception.RemoteApiException;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteApiClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final Deque<Supplier<ClientResponse>> responses = new ArrayDeque<>();
    private final List<ClientRequest> requests = new ArrayList<>();

    private ApiConnection connection;
    private RemoteApiClient client;

    @BeforeEach
    void setUp() {
        connection = new ApiConnection("Sunset Property Group", "https://api.test", "client-1");
        connection.setClientSecretEncrypted("encrypted");

        IngestionProperties properties = IngestionProperties.defaults()
                .withRateLimit(new IngestionProperties.RateLimit(2, Duration.ZERO, 2.0, Duration.ZERO));
        client = createClient(properties);
    }

    @Test
    void fetchResource_RetriesAfterRateLimit() {
        // Arrange
        responses.add(() -> ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, "1")
                .build());
        responses.add(() -> json(HttpStatus.OK, "{\"data\":[{\"id\":\"p1\"},{\"id\":\"p2\"}]}"));

        // Act & Assert
        StepVerifier.create(client.fetchProperties(Map.of()))
                .assertNext(page -> {
                    assertThat(page.items()).hasSize(2);
                    assertThat(page.page()).isEqualTo(1);
                })
                .verifyComplete();

        assertThat(requests).hasSize(2);
    }

    @Test
    void fetchResource_SignsRequestWithBasicAuth() {
        // Arrange
        responses.add(() -> json(HttpStatus.OK, "{\"data\":[]}"));

        // Act
        client.fetchUnits(Map.of("modified_since", "2025-01-01T00:00:00")).block();

        // Assert
        ClientRequest request = requests.get(0);
        URI url = request.url();
        assertThat(url.getPath()).isEqualTo("/v1/units");
        assertThat(url.getQuery()).contains("modified_since=2025-01-01T00:00:00", "page=1", "per_page=100");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).startsWith("Basic ");
    }

    @Test
    void fetchResource_ServerErrorsExhaustRetries() {
        // Arrange
        IngestionProperties properties = IngestionProperties.defaults()
                .withRateLimit(new IngestionProperties.RateLimit(1, Duration.ZERO, 2.0, Duration.ZERO));
        client = createClient(properties);
        responses.add(() -> json(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"boom\"}"));
        responses.add(() -> json(HttpStatus.BAD_GATEWAY, "{\"error\":\"boom\"}"));

        // Act & Assert
        StepVerifier.create(client.fetchVendors(Map.of()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(RemoteApiException.class);
                    RemoteApiException apiError = (RemoteApiException) error;
                    assertThat(apiError.isRetryable()).isFalse();
                    assertThat(apiError.getStatusCode()).isEqualTo(502);
                    assertThat(apiError.getMessage()).contains("after 1 retries");
                })
                .verify();

        assertThat(requests).hasSize(2);
    }

    @Test
    void fetchResource_ClientErrorIsNotRetried() {
        // Arrange
        responses.add(() -> json(HttpStatus.NOT_FOUND, "{\"error\":\"missing\"}"));

        // Act & Assert
        StepVerifier.create(client.fetchLeases(Map.of()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(RemoteApiException.class);
                    assertThat(((RemoteApiException) error).isRetryable()).isFalse();
                    assertThat(error.getMessage()).contains("404");
                })
                .verify();

        assertThat(requests).hasSize(1);
    }

    @Test
    void fetchResource_LongErrorPageIsTruncated() {
        // Arrange
        String page = "<html><body>" + "x".repeat(5000) + "</body></html>";
        responses.add(() -> ClientResponse.create(HttpStatus.FORBIDDEN)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_HTML_VALUE)
                .body(page)
                .build());

        // Act & Assert
        StepVerifier.create(client.fetchProperties(Map.of()))
                .expectErrorSatisfies(error -> {
                    assertThat(error.getMessage()).startsWith("Remote API error: 403 - <html><body>");
                    assertThat(error.getMessage()).endsWith("... (" + page.length() + " chars)");
                    assertThat(error.getMessage().length()).isLessThan(600);
                })
                .verify();
    }

    @Test
    void fetchAll_FollowsNextPageUrl() {
        // Arrange
        responses.add(() -> json(HttpStatus.OK,
                "{\"data\":[{\"id\":\"w1\"},{\"id\":\"w2\"}],\"next_page_url\":\"/v1/work-orders?page=2\"}"));
        responses.add(() -> json(HttpStatus.OK,
                "{\"data\":[{\"id\":\"w3\"}],\"next_page_url\":null}"));

        // Act & Assert
        StepVerifier.create(client.fetchAll(ResourceType.WORK_ORDERS, Map.of()).map(node -> node.get("id").asText()))
                .expectNext("w1", "w2", "w3")
                .verifyComplete();

        assertThat(requests).hasSize(2);
        assertThat(requests.get(1).url().getQuery()).contains("page=2");
    }

    @Test
    void toPage_ReadsMetaHasMore() throws Exception {
        // Arrange
        JsonNode body = objectMapper.readTree("{\"results\":[{\"id\":1}],\"meta\":{\"has_more\":true}}");

        // Act
        ResourcePage page = RemoteApiClient.toPage(ResourceType.EXPENSES, 3, 100, body);

        // Assert
        assertThat(page.items()).hasSize(1);
        assertThat(page.page()).isEqualTo(3);
        assertThat(page.hasMore()).isTrue();
    }

    @Test
    void toPage_FullPageWithoutHintsMeansMore() throws Exception {
        JsonNode full = objectMapper.readTree("[{\"id\":1},{\"id\":2}]");
        JsonNode partial = objectMapper.readTree("[{\"id\":1}]");

        assertThat(RemoteApiClient.toPage(ResourceType.PROPERTIES, 1, 2, full).hasMore()).isTrue();
        assertThat(RemoteApiClient.toPage(ResourceType.PROPERTIES, 1, 2, partial).hasMore()).isFalse();
    }

    @Test
    void testConnection_ReturnsFalseOnUnauthorized() {
        // Arrange
        responses.add(() -> json(HttpStatus.UNAUTHORIZED, "{\"error\":\"bad credentials\"}"));

        // Act & Assert
        StepVerifier.create(client.testConnection())
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void testConnection_UnconfiguredConnectionMakesNoRequest() {
        // Arrange
        connection.setClientSecretEncrypted(null);

        // Act & Assert
        StepVerifier.create(client.testConnection())
                .expectNext(false)
                .verifyComplete();

        assertThat(requests).isEmpty();
    }

    private RemoteApiClient createClient(IngestionProperties properties) {
        WebClient webClient = WebClient.builder()
                .baseUrl("https://api.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    Supplier<ClientResponse> next = responses.poll();
                    if (next == null) {
                        return Mono.error(new IllegalStateException("Unexpected request " + request.url()));
                    }
                    return Mono.just(next.get());
                })
                .build();
        CredentialProvider credentials = conn -> Mono.just(new ClientCredentials("client-1", "secret"));
        return new RemoteApiClient(webClient, connection, credentials, properties);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
