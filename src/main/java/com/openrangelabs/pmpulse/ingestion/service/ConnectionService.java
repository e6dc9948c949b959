package com.openrangelabs.pmpulse.ingestion.service;

import com.openrangelabs.pmpulse.ingestion.client.RemoteApiClientFactory;
import com.openrangelabs.pmpulse.ingestion.entity.ApiConnection;
import com.openrangelabs.pmpulse.ingestion.exception.ConnectionNotFoundException;
import com.openrangelabs.pmpulse.ingestion.repository.ApiConnectionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Service for managing remote API connections
 */
@Service
public class ConnectionService {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionService.class);

    private final ApiConnectionRepository repository;
    private final CredentialService credentialService;
    private final RemoteApiClientFactory clientFactory;

    @Autowired
    public ConnectionService(ApiConnectionRepository repository, CredentialService credentialService,
                             RemoteApiClientFactory clientFactory) {
        this.repository = repository;
        this.credentialService = credentialService;
        this.clientFactory = clientFactory;
    }

    /**
     * Create a connection, encrypting the client secret
     */
    public Mono<ApiConnection> createConnection(String name, String apiBaseUrl, String clientId, String clientSecret) {
        return repository.existsByName(name)
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new IllegalArgumentException("Connection with name '" + name + "' already exists"));
                    }

                    ApiConnection connection = new ApiConnection(name, apiBaseUrl, clientId);
                    if (clientSecret != null && !clientSecret.isBlank()) {
                        connection.setClientSecretEncrypted(credentialService.encryptSecret(clientSecret));
                    }
                    connection.refreshConfiguredStatus();

                    return repository.save(connection)
                            .doOnSuccess(saved -> logger.info("Created connection {} ({})", saved.getName(), saved.getId()));
                });
    }

    /**
     * Update connection settings. Null arguments keep the stored value, so a secret is only replaced when given.
     */
    public Mono<ApiConnection> updateConnection(UUID id, String apiBaseUrl, String clientId, String clientSecret) {
        return getConnection(id)
                .flatMap(connection -> {
                    if (apiBaseUrl != null) {
                        connection.setApiBaseUrl(apiBaseUrl);
                    }
                    if (clientId != null) {
                        connection.setClientId(clientId);
                    }
                    if (clientSecret != null && !clientSecret.isBlank()) {
                        connection.setClientSecretEncrypted(credentialService.encryptSecret(clientSecret));
                    }
                    connection.refreshConfiguredStatus();
                    return repository.save(connection);
                })
                .doOnSuccess(updated -> logger.info("Updated connection {}", id));
    }

    public Mono<ApiConnection> getConnection(UUID id) {
        return repository.findById(id)
                .switchIfEmpty(Mono.error(new ConnectionNotFoundException(id)));
    }

    public Flux<ApiConnection> getConfiguredConnections() {
        return repository.findConfigured();
    }

    public Mono<ApiConnection> markSuccess(ApiConnection connection) {
        connection.markAsSuccess();
        return repository.save(connection);
    }

    public Mono<ApiConnection> markError(ApiConnection connection, String error) {
        connection.markAsError(error);
        return repository.save(connection)
                .doOnSuccess(saved -> logger.warn("Connection {} marked as error: {}", saved.getName(), error));
    }

    /**
     * Probe the remote API with the stored credentials
     */
    public Mono<Boolean> testConnection(UUID id) {
        return getConnection(id)
                .flatMap(connection -> clientFactory.create(connection).testConnection()
                        .flatMap(ok -> (ok ? markSuccess(connection) : markError(connection, "Connection test failed"))
                                .thenReturn(ok)));
    }
}
