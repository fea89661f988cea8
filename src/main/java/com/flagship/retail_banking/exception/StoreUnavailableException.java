package com.flagship.retail_banking.exception;

import java.util.Map;

/**
 * Infrastructure failure (connection loss, database down). Never retried by the engine.
 */
public class StoreUnavailableException extends TransferException {

    public StoreUnavailableException(Throwable cause) {
        super(TransferFailureKind.STORE_UNAVAILABLE,
            "Account store unavailable: " + cause.getMessage(),
            Map.of(),
            cause);
    }
}
