package com.flagship.retail_banking.transfer.event;

import com.flagship.retail_banking.recovery.RecoveryLogEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a failed operation has been written to the recovery log.
 */
@Value
public class TransferFailedEvent implements TransferEvent {
    UUID eventId;
    UUID recoveryLogId;
    String operationType;
    Long senderAccountId;
    Long receiverAccountId;
    BigDecimal attemptedAmount;
    String failureKind;
    String failureReason;
    String correlationId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferFailed";

    // Full reason stays in the recovery log; the event carries a bounded copy
    static final int MAX_REASON_LENGTH = 1000;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferFailedEvent fromEntry(RecoveryLogEntry entry, String correlationId) {
        return new TransferFailedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getOperationType().name(),
            entry.getSenderAccountId(),
            entry.getReceiverAccountId(),
            entry.getAttemptedAmount(),
            entry.getFailureKind().name(),
            shorten(entry.getFailureReason()),
            correlationId,
            entry.getFailedAt()
        );
    }

    private static String shorten(String reason) {
        return reason != null && reason.length() > MAX_REASON_LENGTH
            ? reason.substring(0, MAX_REASON_LENGTH)
            : reason;
    }
}
