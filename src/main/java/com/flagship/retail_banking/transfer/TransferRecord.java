package com.flagship.retail_banking.transfer;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable record of a completed money movement (one row of the transactions table).
 * Created exactly once per successful engine call and never changed afterwards.
 */
@Value
public class TransferRecord {
    long id;
    TransactionType type;
    BigDecimal amount;
    Long senderAccountId;
    Long receiverAccountId;
    TransactionStatus status;
    String description;
    String idempotencyKey;
    Instant createdAt;
}
