package com.purchasingpower.studygraph.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.util.UUID;

/**
 * A single outbound call, tagged with the tenant or agent it runs for.
 *
 * <pre>
 * 🟢 Neo4j → upsertEntities [1f3a9c02] u1
 * 🟢 Neo4j ← upsertEntities [1f3a9c02] u1 (12ms)
 * </pre>
 *
 * Bodies and key/value details are written at DEBUG only.
 */
public class CallContext {

    private final String callId = UUID.randomUUID().toString().substring(0, 8);
    private final ServiceType service;
    private final String operation;
    private final String subject;
    private final Logger logger;
    private final long startedNanos = System.nanoTime();

    public CallContext(ServiceType service, String operation, String subject, Logger logger) {
        this.service = service;
        this.operation = operation;
        this.subject = subject == null ? "-" : subject;
        this.logger = logger;
    }

    public void logRequest(String body, Object... details) {
        logger.info("{} {} → {} [{}] {}", service.getEmoji(), service.getDisplayName(), operation, callId, subject);
        debugBody("Request", body, details);
    }

    public void logResponse(String body, Object... details) {
        Duration elapsed = elapsed();
        if (elapsed.compareTo(service.getSlowAfter()) > 0) {
            logger.warn("{} {} ← {} [{}] {} ({}ms, slow: over {}ms)", service.getEmoji(), service.getDisplayName(),
                    operation, callId, subject, elapsed.toMillis(), service.getSlowAfter().toMillis());
        } else {
            logger.info("{} {} ← {} [{}] {} ({}ms)", service.getEmoji(), service.getDisplayName(),
                    operation, callId, subject, elapsed.toMillis());
        }
        debugBody("Response", body, details);
    }

    public void logError(String errorMessage, Throwable cause) {
        logger.error("{} {} ✖ {} [{}] {} ({}ms): {}", service.getEmoji(), service.getDisplayName(),
                operation, callId, subject, elapsed().toMillis(), errorMessage);
        if (cause != null && logger.isDebugEnabled()) {
            logger.debug("[{}] failure detail", callId, cause);
        }
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private void debugBody(String label, String body, Object... details) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        if (body != null && !body.isEmpty()) {
            logger.debug("[{}] {}: {}", callId, label, body);
        }
        for (int i = 0; details != null && i + 1 < details.length; i += 2) {
            logger.debug("[{}]   {}={}", callId, details[i], details[i + 1]);
        }
    }
}
