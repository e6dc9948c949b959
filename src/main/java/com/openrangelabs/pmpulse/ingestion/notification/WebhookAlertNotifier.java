package com.openrangelabs.pmpulse.ingestion.notification;

import com.openrangelabs.pmpulse.ingestion.config.IngestionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts alerts as JSON to the configured webhook URL
 */
@Component
public class WebhookAlertNotifier implements AlertNotifier {

    private static final Logger logger = LoggerFactory.getLogger(WebhookAlertNotifier.class);

    private final WebClient webClient;
    private final String webhookUrl;

    @Autowired
    public WebhookAlertNotifier(WebClient.Builder webClientBuilder, IngestionProperties properties) {
        this.webClient = webClientBuilder.clone().build();
        this.webhookUrl = properties.alerts().webhookUrl();
    }

    @Override
    public String getChannel() {
        return "webhook";
    }

    @Override
    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    @Override
    public Mono<Void> send(AlertMessage message) {
        if (!isEnabled()) {
            return Mono.empty();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("connection_id", message.connectionId().toString());
        payload.put("consecutive_failures", message.consecutiveFailures());
        payload.put("subject", message.subject());
        payload.put("text", message.body());
        payload.put("recipients", message.recipients());

        return webClient.post()
                .uri(webhookUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .toBodilessEntity()
                .doOnSuccess(response -> logger.info("Sent failure alert for connection {} to webhook",
                        message.connectionId()))
                .then();
    }
}
