package com.openrangelabs.pmpulse.ingestion.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Writes alerts to the application log. Always enabled.
 */
@Component
public class LoggingAlertNotifier implements AlertNotifier {

    private static final Logger logger = LoggerFactory.getLogger(LoggingAlertNotifier.class);

    @Override
    public String getChannel() {
        return "log";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public Mono<Void> send(AlertMessage message) {
        return Mono.fromRunnable(() -> logger.error("ALERT [{}] connection {} recipients {}\n{}",
                message.subject(), message.connectionId(), message.recipients(), message.body()));
    }
}
