package com.flagship.retail_banking.transfer.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of events written to the outbox for transfers.
 */
public interface TransferEvent {

    /**
     * Unique id of this event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    Instant getOccurredAt();

    /**
     * Event type name used for routing.
     */
    String getEventType();
}
