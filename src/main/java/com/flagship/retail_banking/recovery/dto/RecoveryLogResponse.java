package com.flagship.retail_banking.recovery.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_banking.recovery.RecoveryLogEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class RecoveryLogResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("operation_type")
    String operationType;

    @JsonProperty("sender_account_id")
    Long senderAccountId;

    @JsonProperty("receiver_account_id")
    Long receiverAccountId;

    @JsonProperty("attempted_amount")
    BigDecimal attemptedAmount;

    @JsonProperty("failure_kind")
    String failureKind;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("sender_balance_at_failure")
    BigDecimal senderBalanceAtFailure;

    @JsonProperty("additional_details")
    Map<String, Object> additionalDetails;

    @JsonProperty("failed_at")
    Instant failedAt;

    public static RecoveryLogResponse from(RecoveryLogEntry entry) {
        return RecoveryLogResponse.builder()
            .id(entry.getId())
            .operationType(entry.getOperationType().name())
            .senderAccountId(entry.getSenderAccountId())
            .receiverAccountId(entry.getReceiverAccountId())
            .attemptedAmount(entry.getAttemptedAmount())
            .failureKind(entry.getFailureKind().name())
            .failureReason(entry.getFailureReason())
            .senderBalanceAtFailure(entry.getSenderBalanceAtFailure())
            .additionalDetails(entry.getAdditionalDetails())
            .failedAt(entry.getFailedAt())
            .build();
    }
}
