package com.flagship.retail_banking.transfer;

import lombok.Value;

/**
 * Result of a gateway submission: the committed transaction, and whether it
 * was created by this call or returned for a previously used idempotency key.
 */
@Value
public class TransferOutcome {
    TransferRecord record;
    boolean replayed;

    public static TransferOutcome created(TransferRecord record) {
        return new TransferOutcome(record, false);
    }

    public static TransferOutcome replayed(TransferRecord record) {
        return new TransferOutcome(record, true);
    }
}
