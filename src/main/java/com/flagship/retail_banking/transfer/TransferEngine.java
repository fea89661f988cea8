package com.flagship.retail_banking.transfer;

import com.flagship.retail_banking.account.Account;
import com.flagship.retail_banking.account.AccountStore;
import com.flagship.retail_banking.account.BalanceChange;
import com.flagship.retail_banking.audit.AuditOperationType;
import com.flagship.retail_banking.audit.AuditRecorder;
import com.flagship.retail_banking.exception.AccountInactiveException;
import com.flagship.retail_banking.exception.ConcurrencyConflictException;
import com.flagship.retail_banking.exception.InsufficientFundsException;
import com.flagship.retail_banking.exception.InvalidAmountException;
import com.flagship.retail_banking.exception.SameAccountException;
import com.flagship.retail_banking.exception.StoreUnavailableException;
import com.flagship.retail_banking.exception.TransferException;
import com.flagship.retail_banking.observability.CorrelationContext;
import com.flagship.retail_banking.observability.TransferMetrics;
import com.flagship.retail_banking.outbox.OutboxService;
import com.flagship.retail_banking.transfer.event.TransferCompletedEvent;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Moves money between accounts, and into or out of a single account.
 *
 * Every operation is one unit of work:
 * 1. Lock the affected account rows (ascending id order, so two opposite
 *    transfers can never deadlock on each other)
 * 2. Check status and balance against the locked rows
 * 3. Apply the balance changes, write the audit rows, the transaction row
 *    and the TransferCompleted outbox event
 * 4. Commit, or roll everything back on any failure
 *
 * Attempts that fail on lock acquisition or timeout are retried a bounded
 * number of times, then surface as {@link ConcurrencyConflictException}.
 * The engine never writes recovery logs; that is the gateway's job.
 */
@Service
@Slf4j
public class TransferEngine {

    static final String AGGREGATE_TYPE = "Transfer";
    private static final int MONEY_SCALE = 2;

    private final AccountStore accountStore;
    private final AuditRecorder auditRecorder;
    private final TransactionRepository transactionRepository;
    private final OutboxService outboxService;
    private final TransferMetrics metrics;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;
    private final int maxAttempts;
    private final long retryBackoffMs;

    public TransferEngine(AccountStore accountStore,
                          AuditRecorder auditRecorder,
                          TransactionRepository transactionRepository,
                          OutboxService outboxService,
                          TransferMetrics metrics,
                          Clock clock,
                          PlatformTransactionManager transactionManager,
                          @Value("${banking.transfer.max-attempts:3}") int maxAttempts,
                          @Value("${banking.transfer.timeout-seconds:10}") int timeoutSeconds,
                          @Value("${banking.transfer.retry-backoff-ms:50}") long retryBackoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("banking.transfer.max-attempts must be at least 1");
        }
        this.accountStore = accountStore;
        this.auditRecorder = auditRecorder;
        this.transactionRepository = transactionRepository;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.retryBackoffMs = retryBackoffMs;

        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate.setTimeout(timeoutSeconds);
    }

    /**
     * Transfers money from one account to another.
     *
     * @param senderId account to debit
     * @param receiverId account to credit
     * @param amount positive amount with at most two decimal places
     * @param description free text stored with the transaction, may be null
     * @param idempotencyKey client key, unique across transactions, may be null
     * @return the committed transaction
     * @throws InvalidAmountException if the amount is not positive or has more than two decimals
     * @throws SameAccountException if sender and receiver are the same account
     * @throws com.flagship.retail_banking.exception.AccountNotFoundException if either account is missing
     * @throws AccountInactiveException if either account is not ACTIVE
     * @throws InsufficientFundsException if the sender balance is below the amount
     * @throws ConcurrencyConflictException if the locks could not be taken within the retry budget
     * @throws StoreUnavailableException if the database cannot be reached
     */
    public TransferRecord transfer(long senderId, long receiverId, BigDecimal amount,
                                   String description, String idempotencyKey) {
        return timed(TransactionType.TRANSFER, () -> {
            BigDecimal normalized = validateAmount(amount);
            if (senderId == receiverId) {
                throw new SameAccountException(senderId);
            }
            log.info("Transfer requested: sender={}, receiver={}, amount={}", senderId, receiverId, normalized);
            return executeWithRetry(TransactionType.TRANSFER,
                status -> doTransfer(senderId, receiverId, normalized, description, idempotencyKey));
        });
    }

    /**
     * Credits an account from outside the bank (cash or external deposit).
     */
    public TransferRecord deposit(long accountId, BigDecimal amount, String description) {
        return timed(TransactionType.DEPOSIT, () -> {
            BigDecimal normalized = validateAmount(amount);
            log.info("Deposit requested: account={}, amount={}", accountId, normalized);
            return executeWithRetry(TransactionType.DEPOSIT,
                status -> doDeposit(accountId, normalized, description));
        });
    }

    /**
     * Debits an account to outside the bank. Fails with InsufficientFunds like a transfer.
     */
    public TransferRecord withdraw(long accountId, BigDecimal amount, String description) {
        return timed(TransactionType.WITHDRAWAL, () -> {
            BigDecimal normalized = validateAmount(amount);
            log.info("Withdrawal requested: account={}, amount={}", accountId, normalized);
            return executeWithRetry(TransactionType.WITHDRAWAL,
                status -> doWithdraw(accountId, normalized, description));
        });
    }

    private TransferRecord doTransfer(long senderId, long receiverId, BigDecimal amount,
                                      String description, String idempotencyKey) {
        Account first = accountStore.lockById(Math.min(senderId, receiverId));
        Account second = accountStore.lockById(Math.max(senderId, receiverId));
        Account sender = first.getId() == senderId ? first : second;
        Account receiver = first.getId() == senderId ? second : first;

        requireActive(sender);
        requireActive(receiver);
        requireFunds(sender, amount);

        BalanceChange debit = accountStore.applyDelta(senderId, amount.negate());
        BalanceChange credit = accountStore.applyDelta(receiverId, amount);

        TransferRecord record = transactionRepository.insert(TransactionType.TRANSFER, amount,
            senderId, receiverId, description, idempotencyKey, clock.instant());
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(record.getId()));

        String reference = String.valueOf(record.getId());
        auditRecorder.record(debit, AuditOperationType.TRANSFER_DEBIT, reference);
        auditRecorder.record(credit, AuditOperationType.TRANSFER_CREDIT, reference);
        publishCompleted(record);

        log.info("Transfer {} completed: {} -> {}, amount={}, sender balance {} -> {}",
            record.getId(), sender.getAccountNumber(), receiver.getAccountNumber(), amount,
            debit.getOldBalance(), debit.getNewBalance());
        return record;
    }

    private TransferRecord doDeposit(long accountId, BigDecimal amount, String description) {
        Account account = accountStore.lockById(accountId);
        requireActive(account);

        BalanceChange credit = accountStore.applyDelta(accountId, amount);
        TransferRecord record = transactionRepository.insert(TransactionType.DEPOSIT, amount,
            null, accountId, description, null, clock.instant());
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(record.getId()));

        auditRecorder.record(credit, AuditOperationType.DEPOSIT, String.valueOf(record.getId()));
        publishCompleted(record);

        log.info("Deposit {} completed: account={}, balance {} -> {}",
            record.getId(), account.getAccountNumber(), credit.getOldBalance(), credit.getNewBalance());
        return record;
    }

    private TransferRecord doWithdraw(long accountId, BigDecimal amount, String description) {
        Account account = accountStore.lockById(accountId);
        requireActive(account);
        requireFunds(account, amount);

        BalanceChange debit = accountStore.applyDelta(accountId, amount.negate());
        TransferRecord record = transactionRepository.insert(TransactionType.WITHDRAWAL, amount,
            accountId, null, description, null, clock.instant());
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(record.getId()));

        auditRecorder.record(debit, AuditOperationType.WITHDRAWAL, String.valueOf(record.getId()));
        publishCompleted(record);

        log.info("Withdrawal {} completed: account={}, balance {} -> {}",
            record.getId(), account.getAccountNumber(), debit.getOldBalance(), debit.getNewBalance());
        return record;
    }

    private void publishCompleted(TransferRecord record) {
        outboxService.saveEvent(AGGREGATE_TYPE, String.valueOf(record.getId()),
            TransferCompletedEvent.EVENT_TYPE,
            TransferCompletedEvent.fromRecord(record, CorrelationContext.getCorrelationId()));
    }

    private TransferRecord executeWithRetry(TransactionType type, TransactionCallback<TransferRecord> work) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return transactionTemplate.execute(work);
            } catch (ConcurrencyFailureException | QueryTimeoutException | TransactionTimedOutException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{} gave up after {} attempt(s): {}", type, attempt, e.getMessage());
                    throw new ConcurrencyConflictException(attempt, e);
                }
                metrics.incrementLockRetries();
                log.debug("{} attempt {} hit a lock conflict, retrying: {}", type, attempt, e.getMessage());
                backoff(attempt, e);
            } catch (DataAccessResourceFailureException | TransientDataAccessResourceException
                     | CannotCreateTransactionException e) {
                log.error("{} failed, account store unavailable: {}", type, e.getMessage());
                throw new StoreUnavailableException(e);
            }
        }
    }

    private void backoff(int attempt, RuntimeException cause) {
        try {
            Thread.sleep(retryBackoffMs * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyConflictException(attempt, cause);
        }
    }

    private TransferRecord timed(TransactionType type, Supplier<TransferRecord> operation) {
        Instant start = clock.instant();
        try {
            TransferRecord record = operation.get();
            metrics.recordCompleted(type.name(), Duration.between(start, clock.instant()));
            return record;
        } catch (TransferException e) {
            metrics.recordFailed(type.name(), e.getKind().name(), Duration.between(start, clock.instant()));
            log.info("{} failed: kind={}, message={}", type, e.getKind(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    static BigDecimal validateAmount(BigDecimal amount) {
        if (amount == null) {
            throw new InvalidAmountException(null, "amount is required");
        }
        if (amount.signum() <= 0) {
            throw new InvalidAmountException(amount, "must be greater than zero");
        }
        BigDecimal stripped = amount.stripTrailingZeros();
        if (stripped.scale() > MONEY_SCALE) {
            throw new InvalidAmountException(amount, "at most two decimal places are allowed");
        }
        if (amount.compareTo(AccountStore.MAX_BALANCE) > 0) {
            throw new InvalidAmountException(amount, "must not exceed " + AccountStore.MAX_BALANCE);
        }
        return amount.setScale(MONEY_SCALE);
    }

    private static void requireActive(Account account) {
        if (!account.isActive()) {
            throw new AccountInactiveException(account.getId(), account.getAccountNumber(), account.getStatus());
        }
    }

    private static void requireFunds(Account account, BigDecimal amount) {
        if (account.getBalance().compareTo(amount) < 0) {
            throw new InsufficientFundsException(
                account.getId(), account.getAccountNumber(), amount, account.getBalance());
        }
    }
}
