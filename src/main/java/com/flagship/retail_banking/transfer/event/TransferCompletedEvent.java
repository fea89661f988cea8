package com.flagship.retail_banking.transfer.event;

import com.flagship.retail_banking.transfer.TransferRecord;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a transfer, deposit or withdrawal commits.
 * Written in the same unit of work as the balance changes.
 */
@Value
public class TransferCompletedEvent implements TransferEvent {
    UUID eventId;
    long transactionId;
    String transactionType;
    BigDecimal amount;
    Long senderAccountId;
    Long receiverAccountId;
    String idempotencyKey;
    String correlationId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferCompletedEvent fromRecord(TransferRecord record, String correlationId) {
        return new TransferCompletedEvent(
            UUID.randomUUID(),
            record.getId(),
            record.getType().name(),
            record.getAmount(),
            record.getSenderAccountId(),
            record.getReceiverAccountId(),
            record.getIdempotencyKey(),
            correlationId,
            record.getCreatedAt()
        );
    }
}
