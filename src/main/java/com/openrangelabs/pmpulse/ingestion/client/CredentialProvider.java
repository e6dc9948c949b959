package com.openrangelabs.pmpulse.ingestion.client;

import com.openrangelabs.pmpulse.ingestion.entity.ApiConnection;
import reactor.core.publisher.Mono;

/**
 * Supplies the credentials a request against a connection is signed with
 */
public interface CredentialProvider {

    Mono<ClientCredentials> resolve(ApiConnection connection);
}
