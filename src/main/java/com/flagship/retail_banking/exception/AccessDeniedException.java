package com.flagship.retail_banking.exception;

import java.util.Map;

/**
 * The acting customer does not own the account it tried to use.
 * Also raised for accounts that do not exist, so callers cannot enumerate account numbers.
 */
public class AccessDeniedException extends TransferException {

    public AccessDeniedException(long customerId, long accountId) {
        super(TransferFailureKind.ACCESS_DENIED,
            "Account (ID: " + accountId + ") does not belong to customer " + customerId,
            Map.of("customer_id", customerId, "account_id", accountId));
    }

    public AccessDeniedException(long customerId, String accountNumber) {
        super(TransferFailureKind.ACCESS_DENIED,
            "Account " + accountNumber + " does not belong to customer " + customerId,
            Map.of("customer_id", customerId, "account_number", accountNumber));
    }
}
