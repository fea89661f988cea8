package com.flagship.retail_banking.transfer;

public enum TransactionStatus {
    COMPLETED,
    REVERSED
}
