package com.openrangelabs.pmpulse.ingestion.service;

import com.openrangelabs.pmpulse.ingestion.config.IngestionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Per-connection lease in the {@code sync_locks} table. A lease is held by one owner until it is
 * released or expires, so a crashed run cannot block its connection forever.
 */
@Service
public class SyncLockService {

    private static final Logger logger = LoggerFactory.getLogger(SyncLockService.class);

    private final DatabaseClient databaseClient;
    private final Duration lockTtl;
    private final Clock clock;

    @Autowired
    public SyncLockService(DatabaseClient databaseClient, IngestionProperties properties, Clock clock) {
        this.databaseClient = databaseClient;
        this.lockTtl = properties.sync().lockTtl();
        this.clock = clock;
    }

    /**
     * Try to take the lease. Emits false when another owner holds an unexpired lease.
     * With {@code takeOver} the lease is taken regardless of its current holder.
     */
    public Mono<Boolean> acquire(UUID connectionId, String owner, boolean takeOver) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = now.plus(lockTtl);

        String sql = takeOver
                ? """
                  UPDATE sync_locks SET owner = :owner, acquired_at = :now, expires_at = :expiresAt
                  WHERE connection_id = :connectionId
                  """
                : """
                  UPDATE sync_locks SET owner = :owner, acquired_at = :now, expires_at = :expiresAt
                  WHERE connection_id = :connectionId
                  AND (owner IS NULL OR expires_at < :now)
                  """;

        return databaseClient.sql(sql)
                .bind("owner", owner)
                .bind("now", now)
                .bind("expiresAt", expiresAt)
                .bind("connectionId", connectionId)
                .fetch()
                .rowsUpdated()
                .flatMap(updated -> updated > 0 ? Mono.just(true) : insert(connectionId, owner, now, expiresAt))
                .doOnNext(acquired -> {
                    if (acquired) {
                        logger.debug("Acquired sync lock for connection {} ({})", connectionId, owner);
                    } else {
                        logger.info("Sync lock for connection {} is held by another run", connectionId);
                    }
                });
    }

    /**
     * Release the lease if it is still held by the given owner
     */
    public Mono<Boolean> release(UUID connectionId, String owner) {
        return databaseClient.sql("""
                        UPDATE sync_locks SET owner = NULL, expires_at = NULL
                        WHERE connection_id = :connectionId AND owner = :owner
                        """)
                .bind("connectionId", connectionId)
                .bind("owner", owner)
                .fetch()
                .rowsUpdated()
                .map(updated -> updated > 0)
                .doOnNext(released -> logger.debug("Released sync lock for connection {}: {}", connectionId, released));
    }

    private Mono<Boolean> insert(UUID connectionId, String owner, LocalDateTime now, LocalDateTime expiresAt) {
        return databaseClient.sql("""
                        INSERT INTO sync_locks (connection_id, owner, acquired_at, expires_at)
                        VALUES (:connectionId, :owner, :now, :expiresAt)
                        """)
                .bind("connectionId", connectionId)
                .bind("owner", owner)
                .bind("now", now)
                .bind("expiresAt", expiresAt)
                .fetch()
                .rowsUpdated()
                .map(inserted -> inserted > 0)
                // the row exists, so the lease is held
                .onErrorResume(DataIntegrityViolationException.class, e -> Mono.just(false));
    }
}
