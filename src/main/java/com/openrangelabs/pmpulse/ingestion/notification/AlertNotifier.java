package com.openrangelabs.pmpulse.ingestion.notification;

import reactor.core.publisher.Mono;

/**
 * Delivery channel for sync failure alerts
 */
public interface AlertNotifier {

    /**
     * Get the channel name used in logs
     */
    String getChannel();

    /**
     * Whether this channel is configured to deliver alerts
     */
    boolean isEnabled();

    Mono<Void> send(AlertMessage message);
}
