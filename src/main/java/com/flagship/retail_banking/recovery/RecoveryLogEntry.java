package com.flagship.retail_banking.recovery;

import com.flagship.retail_banking.exception.TransferFailureKind;
import com.flagship.retail_banking.transfer.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Diagnostic record of one failed money movement.
 *
 * Drafts built by the gateway leave id and failedAt empty; the
 * {@link RecoveryRecorder} assigns both when persisting.
 */
@Value
@Builder(toBuilder = true)
public class RecoveryLogEntry {
    UUID id;
    TransactionType operationType;
    Long senderAccountId;
    Long receiverAccountId;
    BigDecimal attemptedAmount;
    TransferFailureKind failureKind;
    String failureReason;
    BigDecimal senderBalanceAtFailure;
    Map<String, Object> additionalDetails;
    Instant failedAt;
}
