package com.flagship.retail_banking.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Snapshot of an account row.
 *
 * Immutable: the balance here is whatever was read, the Account Store is the
 * only component that changes it in the database.
 */
@Value
public class Account {
    long id;
    String accountNumber;
    AccountType accountType;
    BigDecimal balance;
    long customerId;
    long branchId;
    AccountStatus status;
    Instant openedAt;
    Instant updatedAt;

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }

    public boolean isOwnedBy(long customerId) {
        return this.customerId == customerId;
    }
}
