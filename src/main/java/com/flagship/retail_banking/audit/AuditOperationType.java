package com.flagship.retail_banking.audit;

/**
 * Operation that caused a balance change.
 * The sign of the recorded change follows the operation: debits and withdrawals lower the balance.
 */
public enum AuditOperationType {
    TRANSFER_DEBIT,
    TRANSFER_CREDIT,
    DEPOSIT,
    WITHDRAWAL
}
