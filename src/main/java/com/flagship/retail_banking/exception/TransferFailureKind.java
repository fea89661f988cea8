package com.flagship.retail_banking.exception;

/**
 * Kinds of failure a balance-mutating operation can end with.
 * Persisted as the failure_kind of a recovery log entry.
 */
public enum TransferFailureKind {
    INVALID_AMOUNT,
    SAME_ACCOUNT,
    ACCOUNT_NOT_FOUND,
    ACCOUNT_INACTIVE,
    INSUFFICIENT_FUNDS,
    CONCURRENCY_CONFLICT,
    STORE_UNAVAILABLE,
    ACCESS_DENIED
}
