package com.flagship.retail_banking.exception;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

public class InvalidAmountException extends TransferException {

    public InvalidAmountException(BigDecimal amount, String reason) {
        super(TransferFailureKind.INVALID_AMOUNT,
            "Invalid amount " + amount + ": " + reason,
            amountDetail(amount));
    }

    private static Map<String, Object> amountDetail(BigDecimal amount) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("amount", amount);
        return details;
    }
}
