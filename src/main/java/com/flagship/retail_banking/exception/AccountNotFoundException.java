package com.flagship.retail_banking.exception;

import java.util.Map;

public class AccountNotFoundException extends TransferException {

    public AccountNotFoundException(long accountId) {
        super(TransferFailureKind.ACCOUNT_NOT_FOUND,
            "Account (ID: " + accountId + ") not found",
            Map.of("account_id", accountId));
    }

    public AccountNotFoundException(String accountNumber) {
        super(TransferFailureKind.ACCOUNT_NOT_FOUND,
            "Account " + accountNumber + " not found",
            Map.of("account_number", accountNumber));
    }
}
