package com.flagship.retail_banking.exception;

import java.util.Map;

/**
 * Locks could not be obtained within the retry budget. Safe for the caller to retry.
 */
public class ConcurrencyConflictException extends TransferException {

    public ConcurrencyConflictException(int attempts, Throwable cause) {
        super(TransferFailureKind.CONCURRENCY_CONFLICT,
            "Could not lock accounts after " + attempts + " attempt(s), please retry",
            Map.of("attempts", attempts),
            cause);
    }
}
