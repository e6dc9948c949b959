package com.openrangelabs.pmpulse.ingestion.repository;

import com.openrangelabs.pmpulse.ingestion.entity.ApiConnection;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for remote API connections
 */
@Repository
public interface ApiConnectionRepository extends R2dbcRepository<ApiConnection, UUID> {

    Mono<ApiConnection> findByName(String name);

    Mono<Boolean> existsByName(String name);

    /**
     * Connections with a base URL, client id and stored secret
     */
    @Query("""
        SELECT * FROM api_connections
        WHERE api_base_url IS NOT NULL AND api_base_url <> ''
        AND client_id IS NOT NULL AND client_id <> ''
        AND client_secret_encrypted IS NOT NULL AND client_secret_encrypted <> ''
        ORDER BY name
        """)
    Flux<ApiConnection> findConfigured();
}
