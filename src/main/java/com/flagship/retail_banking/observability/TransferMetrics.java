package com.flagship.retail_banking.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for balance-mutating operations.
 *
 * Metrics exposed:
 * - transfers.completed: completed operations, tagged by type
 * - transfers.failed: failed operations, tagged by type and failure kind
 * - transfers.latency: engine latency, tagged by type and outcome
 * - transfers.lock.retries: attempts retried after a lock conflict
 * - recovery.log.write.failures: recovery entries that could not be persisted
 * - idempotency.cache: idempotency lookups, tagged hit/miss
 */
@Component
public class TransferMetrics {

    private final MeterRegistry registry;

    private final Counter lockRetries;
    private final Counter recoveryLogWriteFailures;
    private final Counter recoveryLogsWritten;

    public TransferMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.lockRetries = Counter.builder("transfers.lock.retries")
                .description("Attempts retried after a lock conflict or timeout")
                .register(registry);

        this.recoveryLogWriteFailures = Counter.builder("recovery.log.write.failures")
                .description("Recovery log entries that could not be persisted")
                .register(registry);

        this.recoveryLogsWritten = Counter.builder("recovery.log.written")
                .description("Recovery log entries persisted")
                .register(registry);
    }

    public void recordCompleted(String type, Duration latency) {
        registry.counter("transfers.completed", "type", sanitizeTag(type)).increment();
        registry.timer("transfers.latency", "type", sanitizeTag(type), "outcome", "completed").record(latency);
    }

    public void recordFailed(String type, String kind, Duration latency) {
        registry.counter("transfers.failed", "type", sanitizeTag(type), "kind", sanitizeTag(kind)).increment();
        registry.timer("transfers.latency", "type", sanitizeTag(type), "outcome", "failed").record(latency);
    }

    public void incrementLockRetries() {
        lockRetries.increment();
    }

    public void incrementRecoveryLogsWritten() {
        recoveryLogsWritten.increment();
    }

    public void incrementRecoveryLogWriteFailures() {
        recoveryLogWriteFailures.increment();
    }

    public double getRecoveryLogWriteFailures() {
        return recoveryLogWriteFailures.count();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Latency timer for one operation type, mainly for tests and dashboards.
     */
    public Timer latencyTimer(String type, String outcome) {
        return registry.timer("transfers.latency", "type", sanitizeTag(type), "outcome", outcome);
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
