package com.openrangelabs.pmpulse.ingestion.client;

import com.openrangelabs.pmpulse.ingestion.config.IngestionProperties;
import com.openrangelabs.pmpulse.ingestion.entity.ApiConnection;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Creates a {@link RemoteApiClient} for an explicitly passed connection
 */
@Component
public class RemoteApiClientFactory {

    private final WebClient.Builder webClientBuilder;
    private final CredentialProvider credentialProvider;
    private final IngestionProperties properties;

    @Autowired
    public RemoteApiClientFactory(WebClient.Builder webClientBuilder, CredentialProvider credentialProvider,
                                  IngestionProperties properties) {
        this.webClientBuilder = webClientBuilder;
        this.credentialProvider = credentialProvider;
        this.properties = properties;
    }

    public RemoteApiClient create(ApiConnection connection) {
        String baseUrl = connection.getApiBaseUrl() != null && !connection.getApiBaseUrl().isBlank()
                ? connection.getApiBaseUrl()
                : properties.api().baseUrl();
        WebClient webClient = webClientBuilder.clone()
                .baseUrl(baseUrl)
                .build();
        return new RemoteApiClient(webClient, connection, credentialProvider, properties);
    }
}
