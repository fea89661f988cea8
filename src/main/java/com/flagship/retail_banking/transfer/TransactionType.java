package com.flagship.retail_banking.transfer;

/**
 * Kind of completed money movement.
 * DEPOSIT has no sender account, WITHDRAWAL has no receiver account.
 */
public enum TransactionType {
    TRANSFER,
    DEPOSIT,
    WITHDRAWAL
}
