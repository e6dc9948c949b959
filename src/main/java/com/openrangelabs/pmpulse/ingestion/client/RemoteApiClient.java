package com.openrangelabs.pmpulse.ingestion.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openrangelabs.pmpulse.ingestion.config.IngestionProperties;
import com.openrangelabs.pmpulse.ingestion.entity.ApiConnection;
import com.openrangelabs.pmpulse.ingestion.exception.RemoteApiException;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for the property-management API, bound to one connection.
 *
 * <p>Every call goes through {@link #request}, which signs the request with the
 * connection's credentials and retries rate-limited (429) and server (5xx) responses
 * with backoff, up to the configured maximum. Other 4xx responses and exhausted
 * retries surface as a non-retryable {@link RemoteApiException}.
 */
public class RemoteApiClient {

    private static final Logger logger = LoggerFactory.getLogger(RemoteApiClient.class);

    static final String API_PREFIX = "/v1/";

    private final WebClient webClient;
    private final ApiConnection connection;
    private final CredentialProvider credentialProvider;
    private final IngestionProperties.RateLimit rateLimit;
    private final Duration timeout;
    private final int perPage;
    private final int maxPages;

    public RemoteApiClient(WebClient webClient, ApiConnection connection, CredentialProvider credentialProvider,
                           IngestionProperties properties) {
        this.webClient = webClient;
        this.connection = connection;
        this.credentialProvider = credentialProvider;
        this.rateLimit = properties.rateLimit();
        this.timeout = properties.api().timeout();
        this.perPage = properties.sync().batchSize();
        this.maxPages = properties.sync().maxPages();
    }

    public boolean isConfigured() {
        return connection.isConfigured();
    }

    public ApiConnection getConnection() {
        return connection;
    }

    /**
     * Probe the API with a single-record request. Emits false on any failure, never an error.
     */
    public Mono<Boolean> testConnection() {
        if (!isConfigured()) {
            return Mono.just(false);
        }
        return Mono.defer(() -> fetchResource(ResourceType.PROPERTIES, Map.of("per_page", "1")))
                .map(page -> true)
                .onErrorResume(error -> {
                    logger.error("Connection test failed for {}: {}", connection.getName(), error.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Fetch one page of a resource. {@code page} and {@code per_page} default to 1 and the configured batch size.
     */
    public Mono<ResourcePage> fetchResource(ResourceType type, Map<String, String> params) {
        Map<String, String> query = new LinkedHashMap<>(params);
        query.putIfAbsent("page", "1");
        query.putIfAbsent("per_page", String.valueOf(perPage));
        int page = Integer.parseInt(query.get("page"));
        int pageSize = Integer.parseInt(query.get("per_page"));

        return request(API_PREFIX + type.getEndpoint(), query)
                .map(body -> toPage(type, page, pageSize, body));
    }

    /**
     * Stream every record of a resource, following pages until the API reports no more
     */
    public Flux<JsonNode> fetchAll(ResourceType type, Map<String, String> params) {
        return fetchPage(type, 1, params)
                .expand(current -> current.hasMore() && current.page() < maxPages
                        ? fetchPage(type, current.page() + 1, params)
                        : Mono.empty())
                .doOnNext(page -> logger.debug("Fetched {} page {} ({} records)",
                        type.getKey(), page.page(), page.items().size()))
                .concatMapIterable(ResourcePage::items);
    }

    public Mono<ResourcePage> fetchProperties(Map<String, String> params) {
        return fetchResource(ResourceType.PROPERTIES, params);
    }

    public Mono<ResourcePage> fetchUnits(Map<String, String> params) {
        return fetchResource(ResourceType.UNITS, params);
    }

    public Mono<ResourcePage> fetchVendors(Map<String, String> params) {
        return fetchResource(ResourceType.VENDORS, params);
    }

    public Mono<ResourcePage> fetchLeases(Map<String, String> params) {
        return fetchResource(ResourceType.LEASES, params);
    }

    public Mono<ResourcePage> fetchWorkOrders(Map<String, String> params) {
        return fetchResource(ResourceType.WORK_ORDERS, params);
    }

    public Mono<ResourcePage> fetchExpenses(Map<String, String> params) {
        return fetchResource(ResourceType.EXPENSES, params);
    }

    private Mono<ResourcePage> fetchPage(ResourceType type, int page, Map<String, String> params) {
        Map<String, String> query = new LinkedHashMap<>(params);
        query.put("page", String.valueOf(page));
        return fetchResource(type, query);
    }

    /**
     * Authenticated GET with retry on 429 and 5xx
     */
    Mono<JsonNode> request(String path, Map<String, String> query) {
        return Mono.defer(() -> attempt(path, query))
                .retryWhen(retryPolicy(path))
                .doOnError(RemoteApiException.class, error -> logger.error("Remote API request {} failed: {}",
                        path, error.getMessage()));
    }

    private Mono<JsonNode> attempt(String path, Map<String, String> query) {
        return credentialProvider.resolve(connection)
                .flatMap(credentials -> webClient.get()
                        .uri(uriBuilder -> {
                            uriBuilder.path(path);
                            query.forEach(uriBuilder::queryParam);
                            return uriBuilder.build();
                        })
                        .headers(headers -> headers.setBasicAuth(credentials.clientId(), credentials.clientSecret()))
                        .accept(MediaType.APPLICATION_JSON)
                        .exchangeToMono(this::handleResponse))
                .timeout(timeout)
                .onErrorMap(WebClientRequestException.class, RemoteApiException::connectionFailure)
                .onErrorMap(TimeoutException.class, RemoteApiException::connectionFailure);
    }

    private Mono<JsonNode> handleResponse(ClientResponse response) {
        HttpStatusCode status = response.statusCode();

        if (status.is2xxSuccessful()) {
            return response.bodyToMono(JsonNode.class)
                    .defaultIfEmpty(JsonNodeFactory.instance.objectNode());
        }

        if (status.value() == 429) {
            long retryAfter = parseRetryAfter(response.headers().asHttpHeaders());
            return response.releaseBody()
                    .then(Mono.<JsonNode>error(RemoteApiException.rateLimited(retryAfter)));
        }

        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.<JsonNode>error(status.is5xxServerError()
                        ? RemoteApiException.serverError(status.value(), body)
                        : RemoteApiException.clientError(status.value(), body)));
    }

    private Retry retryPolicy(String path) {
        int maxRetries = rateLimit.maxRetries();
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            if (!(failure instanceof RemoteApiException apiError) || !apiError.isRetryable()) {
                return Mono.<Long>error(failure);
            }

            long retryNumber = signal.totalRetries() + 1;
            if (retryNumber > maxRetries) {
                return Mono.<Long>error(RemoteApiException.retriesExhausted(apiError, maxRetries));
            }

            Duration delay = delayFor(apiError, retryNumber);
            logger.warn("Remote API {} returned {} (retry {}/{}), waiting {} ms",
                    path, apiError.getStatusCode(), retryNumber, maxRetries, delay.toMillis());
            return Mono.delay(delay).thenReturn(retryNumber);
        }));
    }

    private Duration delayFor(RemoteApiException error, long retryNumber) {
        if (error.hasRetryAfter()) {
            Duration hinted = Duration.ofSeconds(error.getRetryAfterSeconds());
            return hinted.compareTo(rateLimit.maxBackoff()) > 0 ? rateLimit.maxBackoff() : hinted;
        }
        return rateLimit.backoffFor(retryNumber);
    }

    private static long parseRetryAfter(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return -1;
        }
        try {
            return Math.max(0, Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            // HTTP-date form is not used by this API; fall back to computed backoff
            return -1;
        }
    }

    static ResourcePage toPage(ResourceType type, int page, int pageSize, JsonNode body) {
        JsonNode data = body.isArray() ? body : body.has("data") ? body.get("data") : body.path("results");
        List<JsonNode> items = new ArrayList<>();
        if (data.isArray()) {
            data.forEach(items::add);
        }

        boolean hasMore;
        if (body.has("next_page_url")) {
            JsonNode next = body.get("next_page_url");
            hasMore = !next.isNull() && !next.asText().isBlank();
        } else if (body.path("meta").has("has_more")) {
            hasMore = body.path("meta").path("has_more").asBoolean(false);
        } else {
            hasMore = !items.isEmpty() && items.size() >= pageSize;
        }
        return new ResourcePage(type, page, items, hasMore);
    }
}
