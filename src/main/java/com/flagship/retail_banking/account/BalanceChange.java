package com.flagship.retail_banking.account;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of applying a signed delta to one account.
 * Invariant: newBalance - oldBalance equals the applied delta.
 */
@Value
public class BalanceChange {
    long accountId;
    BigDecimal oldBalance;
    BigDecimal newBalance;

    public BigDecimal getDelta() {
        return newBalance.subtract(oldBalance);
    }
}
