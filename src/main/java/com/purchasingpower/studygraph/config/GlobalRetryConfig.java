package com.purchasingpower.studygraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Global retry configuration for transient failures of the completion service and the graph store.
 *
 * <p>Properties are loaded from the {@code app.retry} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   retry:
 *     max-attempts: 3
 *     backoff-ms: 1000
 *     max-backoff-ms: 10000
 * </pre>
 *
 * <p><b>Exponential Backoff Calculation:</b>
 * For attempt N (starting at 0), the delay is:
 * <pre>
 *   delay = min(backoff-ms * 2^N, max-backoff-ms)   (plus reactor's default jitter)
 * </pre>
 *
 * <p>Only idempotent calls are retried: graph upserts/reads (through the driver's managed
 * transactions) and completion requests, which carry no server-side effect.
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.retry")
@Data
public class GlobalRetryConfig {

    /**
     * Maximum number of retry attempts for transient failures.
     * Total attempts = initial attempt + retries.
     */
    private int maxAttempts = 3;

    /**
     * Initial backoff delay in milliseconds before the first retry.
     */
    private long backoffMs = 1000;

    /**
     * Upper bound for any single backoff delay.
     */
    private long maxBackoffMs = 10000;

    public Duration initialBackoff() {
        return Duration.ofMillis(backoffMs);
    }

    public Duration maxBackoff() {
        return Duration.ofMillis(maxBackoffMs);
    }

    /**
     * Total time budget the Neo4j driver may spend retrying a managed transaction.
     */
    public Duration transactionRetryBudget() {
        return Duration.ofMillis(maxBackoffMs * Math.max(1, maxAttempts));
    }
}
