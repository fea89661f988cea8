package com.flagship.retail_banking.transfer;

import com.flagship.retail_banking.account.Account;
import com.flagship.retail_banking.account.AccountStore;
import com.flagship.retail_banking.exception.AccessDeniedException;
import com.flagship.retail_banking.exception.AccountNotFoundException;
import com.flagship.retail_banking.exception.InsufficientFundsException;
import com.flagship.retail_banking.exception.TransferException;
import com.flagship.retail_banking.observability.CorrelationContext;
import com.flagship.retail_banking.observability.TransferMetrics;
import com.flagship.retail_banking.recovery.RecoveryLogEntry;
import com.flagship.retail_banking.recovery.RecoveryRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for customer-initiated money movements.
 *
 * Checks that the acting customer owns the debited account, calls the
 * {@link TransferEngine}, and on any engine failure writes a recovery log
 * entry before rethrowing the original failure. A recovery log that cannot be
 * written is logged and counted but never replaces that failure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferGateway {

    /** Width of transactions.idempotency_key. */
    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 100;

    private final TransferEngine transferEngine;
    private final AccountStore accountStore;
    private final TransactionRepository transactionRepository;
    private final IdempotencyService idempotencyService;
    private final RecoveryRecorder recoveryRecorder;
    private final TransferMetrics metrics;

    /**
     * Transfers money from one of the actor's accounts to any account, by number.
     *
     * @param actorId customer performing the transfer
     * @param senderAccountId account to debit, must belong to the actor
     * @param receiverAccountNumber account to credit
     * @param amount amount to move
     * @param description free text, may be null
     * @param idempotencyKey client key, may be null
     * @return the committed transaction, possibly from an earlier call with the same key
     * @throws AccessDeniedException if the sender account is missing or owned by someone else
     * @throws IllegalArgumentException if the idempotency key is longer than 100 characters
     * @throws IllegalStateException if the key already belongs to another customer's transfer
     * @throws TransferException for every engine failure, after the recovery log was attempted
     */
    public TransferOutcome submitTransfer(long actorId, long senderAccountId, String receiverAccountNumber,
                                          BigDecimal amount, String description, String idempotencyKey) {
        String key = idempotencyKey != null && !idempotencyKey.isBlank() ? idempotencyKey : null;
        if (key != null && key.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw new IllegalArgumentException(
                "Idempotency key must be at most " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
        if (key != null) {
            Optional<TransferRecord> previous = findReplay(actorId, key);
            if (previous.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotency key {} already used, returning transaction {}",
                    key, previous.get().getId());
                return TransferOutcome.replayed(previous.get());
            }
            metrics.recordIdempotencyMiss();
        }

        Account sender = accountStore.findById(senderAccountId)
            .filter(account -> account.isOwnedBy(actorId))
            .orElseThrow(() -> {
                log.warn("Customer {} denied transfer from account {}", actorId, senderAccountId);
                return new AccessDeniedException(actorId, senderAccountId);
            });
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(sender.getId()));

        Long receiverId = null;
        try {
            Account receiver = accountStore.findByNumber(receiverAccountNumber)
                .orElseThrow(() -> new AccountNotFoundException(receiverAccountNumber));
            receiverId = receiver.getId();

            TransferRecord record = transferEngine.transfer(
                sender.getId(), receiver.getId(), amount, description, key);
            if (key != null) {
                idempotencyService.remember(key, record.getId());
            }
            return TransferOutcome.created(record);

        } catch (TransferException e) {
            Map<String, Object> details = baseDetails(actorId, e);
            details.put("sender_account_number", sender.getAccountNumber());
            details.put("receiver_account_number", receiverAccountNumber);
            if (key != null) {
                details.put("idempotency_key", key);
            }
            recordFailure(RecoveryLogEntry.builder()
                .operationType(TransactionType.TRANSFER)
                .senderAccountId(sender.getId())
                .receiverAccountId(receiverId)
                .attemptedAmount(amount)
                .failureKind(e.getKind())
                .failureReason(e.getMessage())
                .senderBalanceAtFailure(observedBalance(e, sender))
                .additionalDetails(details)
                .build());
            throw e;

        } catch (DuplicateKeyException e) {
            // Another request with the same key committed first
            if (key == null) {
                throw e;
            }
            TransferRecord winner = transactionRepository.findByIdempotencyKey(key).orElseThrow(() -> e);
            requireReplayOwner(actorId, key, winner);
            metrics.recordIdempotencyHit();
            log.info("Concurrent submission with idempotency key {} lost to transaction {}", key, winner.getId());
            return TransferOutcome.replayed(winner);

        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    /**
     * Deposits into one of the actor's accounts.
     */
    public TransferRecord deposit(long actorId, String accountNumber, BigDecimal amount, String description) {
        Account account = ownedAccount(actorId, accountNumber);
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(account.getId()));
        try {
            return transferEngine.deposit(account.getId(), amount, description);
        } catch (TransferException e) {
            Map<String, Object> details = baseDetails(actorId, e);
            details.put("account_number", account.getAccountNumber());
            details.put("account_balance", account.getBalance());
            recordFailure(RecoveryLogEntry.builder()
                .operationType(TransactionType.DEPOSIT)
                .receiverAccountId(account.getId())
                .attemptedAmount(amount)
                .failureKind(e.getKind())
                .failureReason(e.getMessage())
                .additionalDetails(details)
                .build());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    /**
     * Withdraws from one of the actor's accounts.
     */
    public TransferRecord withdraw(long actorId, String accountNumber, BigDecimal amount, String description) {
        Account account = ownedAccount(actorId, accountNumber);
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(account.getId()));
        try {
            return transferEngine.withdraw(account.getId(), amount, description);
        } catch (TransferException e) {
            Map<String, Object> details = baseDetails(actorId, e);
            details.put("account_number", account.getAccountNumber());
            recordFailure(RecoveryLogEntry.builder()
                .operationType(TransactionType.WITHDRAWAL)
                .senderAccountId(account.getId())
                .attemptedAmount(amount)
                .failureKind(e.getKind())
                .failureReason(e.getMessage())
                .senderBalanceAtFailure(observedBalance(e, account))
                .additionalDetails(details)
                .build());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    /**
     * Loads an account by number if the actor owns it.
     *
     * @throws AccessDeniedException if the account is missing or belongs to someone else
     */
    public Account ownedAccount(long actorId, String accountNumber) {
        return accountStore.findByNumber(accountNumber)
            .filter(account -> account.isOwnedBy(actorId))
            .orElseThrow(() -> new AccessDeniedException(actorId, accountNumber));
    }

    /**
     * A transaction is visible only to the owners of either side of it;
     * for anyone else it does not exist.
     */
    public Optional<TransferRecord> findTransaction(long actorId, long transactionId) {
        return transactionRepository.findById(transactionId)
            .filter(r -> ownsAccount(actorId, r.getSenderAccountId())
                || ownsAccount(actorId, r.getReceiverAccountId()));
    }

    /**
     * Writes a recovery entry; failures are logged and counted, never thrown.
     */
    Optional<RecoveryLogEntry> recordFailure(RecoveryLogEntry draft) {
        try {
            RecoveryLogEntry entry = recoveryRecorder.record(draft);
            metrics.incrementRecoveryLogsWritten();
            return Optional.of(entry);
        } catch (RuntimeException e) {
            metrics.incrementRecoveryLogWriteFailures();
            log.error("Failed to write recovery log for {} of {} (sender={}, receiver={}, kind={}): {}",
                draft.getOperationType(), draft.getAttemptedAmount(), draft.getSenderAccountId(),
                draft.getReceiverAccountId(), draft.getFailureKind(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    private Optional<TransferRecord> findReplay(long actorId, String key) {
        Optional<TransferRecord> previous = idempotencyService.findTransactionId(key)
            .map(id -> transactionRepository.findById(id).orElseThrow(() -> new IllegalStateException(
                "Transaction found by idempotency key but not by ID: " + id)));
        previous.ifPresent(record -> requireReplayOwner(actorId, key, record));
        return previous;
    }

    /**
     * Only the owner of the original sender account may replay a key.
     * Anyone else gets a conflict that reveals nothing about the stored transaction.
     */
    private void requireReplayOwner(long actorId, String key, TransferRecord record) {
        if (!ownsAccount(actorId, record.getSenderAccountId())) {
            log.warn("Customer {} reused idempotency key {} of another customer's transaction", actorId, key);
            throw new IllegalStateException("Idempotency key is already in use");
        }
    }

    private boolean ownsAccount(long actorId, Long accountId) {
        return accountId != null && accountStore.findById(accountId)
            .map(account -> account.isOwnedBy(actorId))
            .orElse(false);
    }

    private static Map<String, Object> baseDetails(long actorId, TransferException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("actor_id", actorId);
        details.put("error_message", e.getMessage());
        if (e instanceof InsufficientFundsException) {
            details.put("deficit_amount", ((InsufficientFundsException) e).getShortfall());
        }
        if (!e.getDetails().isEmpty()) {
            details.put("failure_details", e.getDetails());
        }
        String correlationId = CorrelationContext.getCorrelationId();
        if (correlationId != null) {
            details.put("correlation_id", correlationId);
        }
        return details;
    }

    /**
     * Balance seen under lock when the engine reported it, otherwise the pre-call snapshot.
     */
    private static BigDecimal observedBalance(TransferException e, Account debited) {
        if (e instanceof InsufficientFundsException) {
            InsufficientFundsException insufficient = (InsufficientFundsException) e;
            if (insufficient.getAccountId() == debited.getId()) {
                return insufficient.getAvailable();
            }
        }
        return debited.getBalance();
    }
}
