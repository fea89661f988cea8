package com.flagship.retail_banking.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_banking.transfer.TransactionStatus;
import com.flagship.retail_banking.transfer.TransactionType;
import com.flagship.retail_banking.transfer.TransferRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class TransferResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("sender_account_id")
    Long senderAccountId;

    @JsonProperty("receiver_account_id")
    Long receiverAccountId;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("description")
    String description;

    @JsonProperty("idempotency_key")
    String idempotencyKey;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("replayed")
    boolean replayed;

    public static TransferResponse from(TransferRecord record) {
        return from(record, false);
    }

    public static TransferResponse from(TransferRecord record, boolean replayed) {
        return TransferResponse.builder()
            .id(record.getId())
            .type(record.getType())
            .amount(record.getAmount())
            .senderAccountId(record.getSenderAccountId())
            .receiverAccountId(record.getReceiverAccountId())
            .status(record.getStatus())
            .description(record.getDescription())
            .idempotencyKey(record.getIdempotencyKey())
            .createdAt(record.getCreatedAt())
            .replayed(replayed)
            .build();
    }
}
