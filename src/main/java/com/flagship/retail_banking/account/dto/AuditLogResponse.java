package com.flagship.retail_banking.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_banking.audit.AuditLogEntry;
import com.flagship.retail_banking.audit.AuditOperationType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class AuditLogResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("account_id")
    long accountId;

    @JsonProperty("old_balance")
    BigDecimal oldBalance;

    @JsonProperty("new_balance")
    BigDecimal newBalance;

    @JsonProperty("operation_type")
    AuditOperationType operationType;

    @JsonProperty("transaction_reference")
    String transactionReference;

    @JsonProperty("changed_at")
    Instant changedAt;

    public static AuditLogResponse from(AuditLogEntry entry) {
        return AuditLogResponse.builder()
            .id(entry.getId())
            .accountId(entry.getAccountId())
            .oldBalance(entry.getOldBalance())
            .newBalance(entry.getNewBalance())
            .operationType(entry.getOperationType())
            .transactionReference(entry.getTransactionReference())
            .changedAt(entry.getChangedAt())
            .build();
    }
}
