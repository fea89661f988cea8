package com.flagship.retail_banking.exception;

import java.util.Map;

public class SameAccountException extends TransferException {

    public SameAccountException(long accountId) {
        super(TransferFailureKind.SAME_ACCOUNT,
            "Cannot transfer to the same account (ID: " + accountId + ")",
            Map.of("account_id", accountId));
    }
}
