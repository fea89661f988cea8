package com.flagship.retail_banking.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for an outbox event.
 *
 * An outbox event is a fact about a transfer that still has to reach Kafka.
 * It is written in the same unit of work as the fact it describes, then
 * published asynchronously by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Transfer" or "RecoveryLog"
    String aggregateId;        // transaction id or recovery log id
    String eventType;          // e.g. "TransferCompleted"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;

    /**
     * Creates a new unpublished outbox event.
     */
    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
