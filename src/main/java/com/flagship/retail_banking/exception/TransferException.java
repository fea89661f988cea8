package com.flagship.retail_banking.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for typed failures of the transfer core.
 *
 * Every failure carries its {@link TransferFailureKind} plus a small map of
 * diagnostic fields (attempted amount, observed balance, shortfall...) that the
 * gateway copies into the recovery log and the API error body.
 *
 * Throwing one of these from inside a unit of work rolls it back.
 */
public abstract class TransferException extends RuntimeException {

    private final TransferFailureKind kind;
    private final Map<String, Object> details;

    protected TransferException(TransferFailureKind kind, String message, Map<String, Object> details) {
        this(kind, message, details, null);
    }

    protected TransferException(TransferFailureKind kind, String message,
                                Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public TransferFailureKind getKind() {
        return kind;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
