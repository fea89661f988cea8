package com.flagship.retail_banking.exception;

import com.flagship.retail_banking.account.AccountStatus;

import java.util.Map;

public class AccountInactiveException extends TransferException {

    public AccountInactiveException(long accountId, String accountNumber, AccountStatus status) {
        super(TransferFailureKind.ACCOUNT_INACTIVE,
            String.format("Account %s is %s", accountNumber, status),
            Map.of("account_id", accountId,
                   "account_number", accountNumber,
                   "status", status.name()));
    }
}
