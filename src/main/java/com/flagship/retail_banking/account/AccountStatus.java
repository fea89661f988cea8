package com.flagship.retail_banking.account;

/**
 * Lifecycle status of an account.
 * Only ACTIVE accounts can be debited or credited. Closing sets the status; rows are never deleted.
 */
public enum AccountStatus {
    ACTIVE,
    CLOSED,
    FROZEN
}
