package com.flagship.retail_banking.audit;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One balance change on one account. Append-only.
 *
 * Key invariant: newBalance - oldBalance equals the signed amount the
 * triggering operation applied to this account.
 */
@Value
public class AuditLogEntry {
    Long id;
    long accountId;
    BigDecimal oldBalance;
    BigDecimal newBalance;
    AuditOperationType operationType;
    String transactionReference;
    Instant changedAt;

    public BigDecimal getDelta() {
        return newBalance.subtract(oldBalance);
    }
}
