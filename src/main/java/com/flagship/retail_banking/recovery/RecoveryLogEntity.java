package com.flagship.retail_banking.recovery;

import com.flagship.retail_banking.exception.TransferFailureKind;
import com.flagship.retail_banking.transfer.TransactionType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for the recovery_logs table. Rows are inserted once and never updated.
 * Additional details are kept as a JSON string.
 */
@Entity
@Table(name = "recovery_logs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RecoveryLogEntity {

    static final int MAX_REASON_LENGTH = 2000;
    static final int MAX_DETAILS_LENGTH = 4000;

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation_type", nullable = false, length = 50)
    private TransactionType operationType;

    @Column(name = "sender_account_id")
    private Long senderAccountId;

    @Column(name = "receiver_account_id")
    private Long receiverAccountId;

    @Column(name = "attempted_amount", precision = 15, scale = 2)
    private BigDecimal attemptedAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind", nullable = false, length = 50)
    private TransferFailureKind failureKind;

    @Column(name = "failure_reason", nullable = false, length = MAX_REASON_LENGTH)
    private String failureReason;

    @Column(name = "sender_balance_at_failure", precision = 15, scale = 2)
    private BigDecimal senderBalanceAtFailure;

    @Column(name = "additional_details", length = MAX_DETAILS_LENGTH)
    private String additionalDetails;

    @Column(name = "failed_at", nullable = false)
    private Instant failedAt;

    static RecoveryLogEntity fromDomain(RecoveryLogEntry entry, String detailsJson) {
        RecoveryLogEntity entity = new RecoveryLogEntity();
        entity.id = entry.getId();
        entity.operationType = entry.getOperationType();
        entity.senderAccountId = entry.getSenderAccountId();
        entity.receiverAccountId = entry.getReceiverAccountId();
        entity.attemptedAmount = entry.getAttemptedAmount();
        entity.failureKind = entry.getFailureKind();
        entity.failureReason = truncate(entry.getFailureReason(), MAX_REASON_LENGTH);
        entity.senderBalanceAtFailure = entry.getSenderBalanceAtFailure();
        entity.additionalDetails = detailsJson;
        entity.failedAt = entry.getFailedAt();
        return entity;
    }

    RecoveryLogEntry toDomain(Map<String, Object> details) {
        return RecoveryLogEntry.builder()
            .id(id)
            .operationType(operationType)
            .senderAccountId(senderAccountId)
            .receiverAccountId(receiverAccountId)
            .attemptedAmount(attemptedAmount)
            .failureKind(failureKind)
            .failureReason(failureReason)
            .senderBalanceAtFailure(senderBalanceAtFailure)
            .additionalDetails(details)
            .failedAt(failedAt)
            .build();
    }

    static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
