package com.flagship.retail_banking.exception;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a debit would take a balance below zero.
 * Carries the balance observed under lock so the caller can log it.
 */
public class InsufficientFundsException extends TransferException {

    private final long accountId;
    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientFundsException(long accountId, String accountNumber,
                                      BigDecimal required, BigDecimal available) {
        super(TransferFailureKind.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds in account %s. Available: %s, Required: %s, Shortfall: %s",
                accountNumber, available, required, required.subtract(available)),
            details(accountNumber, required, available));
        this.accountId = accountId;
        this.required = required;
        this.available = available;
    }

    public long getAccountId() {
        return accountId;
    }

    public BigDecimal getRequired() {
        return required;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getShortfall() {
        return required.subtract(available);
    }

    private static Map<String, Object> details(String accountNumber, BigDecimal required, BigDecimal available) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("account_number", accountNumber);
        details.put("required", required);
        details.put("available", available);
        details.put("shortfall", required.subtract(available));
        return details;
    }
}
