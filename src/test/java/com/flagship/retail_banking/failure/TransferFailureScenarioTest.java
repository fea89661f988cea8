package com.flagship.retail_banking.failure;

import com.flagship.retail_banking.account.Account;
import com.flagship.retail_banking.account.AccountStore;
import com.flagship.retail_banking.account.AccountType;
import com.flagship.retail_banking.exception.ConcurrencyConflictException;
import com.flagship.retail_banking.exception.InsufficientFundsException;
import com.flagship.retail_banking.exception.TransferException;
import com.flagship.retail_banking.exception.TransferFailureKind;
import com.flagship.retail_banking.recovery.RecoveryLogEntry;
import com.flagship.retail_banking.recovery.RecoveryRecorder;
import com.flagship.retail_banking.transfer.TransactionRepository;
import com.flagship.retail_banking.transfer.TransferEngine;
import com.flagship.retail_banking.transfer.TransferGateway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Failure Scenario Tests on PostgreSQL
 *
 * ============================================================================
 * PURPOSE: Verify transfer behavior under contention on the production database
 * ============================================================================
 *
 * 1. CONCURRENT DEBITS
 *    - Two transfers racing for the same balance: exactly one wins
 *    - Many random transfers: money is conserved, no balance goes negative
 *
 * 2. LOCK TIMEOUTS
 *    - A row held by another transaction longer than lock_timeout
 *      ends in CONCURRENCY_CONFLICT after the retry budget, with no balance change
 *
 * 3. DATABASE CONSTRAINTS
 *    - The non-negative balance check rejects writes that bypass the engine
 *
 * ============================================================================
 * KEY INVARIANTS VERIFIED
 * ============================================================================
 *
 * 1. A TRANSFER MOVES MONEY ENTIRELY OR NOT AT ALL
 * 2. THE SUM OF ALL BALANCES NEVER CHANGES THROUGH TRANSFERS
 * 3. EVERY FAILED TRANSFER LEAVES ONE RECOVERY ENTRY
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class TransferFailureScenarioTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("retail_banking_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Short lock waits so the timeout scenario finishes quickly
        registry.add("spring.datasource.hikari.connection-init-sql", () -> "SET lock_timeout = '500ms'");
        registry.add("banking.transfer.max-attempts", () -> "2");
        registry.add("banking.transfer.retry-backoff-ms", () -> "10");
    }

    @Autowired
    private TransferGateway transferGateway;

    @Autowired
    private TransferEngine transferEngine;

    @Autowired
    private AccountStore accountStore;

    @Autowired
    private TransactionRepository transactionRepository;

    @Autowired
    private RecoveryRecorder recoveryRecorder;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static long uniqueCustomer() {
        return ThreadLocalRandom.current().nextLong(1, 1_000_000_000_000L);
    }

    private Account openAccount(long customerId, String balance) {
        String number = "PG" + ThreadLocalRandom.current().nextLong(1_000_000_000L, 9_999_999_999L);
        return accountStore.open(number, AccountType.CHECKING, customerId, 1L, new BigDecimal(balance));
    }

    private BigDecimal balanceOf(Account account) {
        return accountStore.getById(account.getId()).getBalance();
    }

    @Nested
    @DisplayName("Concurrent debits")
    class ConcurrentDebits {

        @Test
        @DisplayName("Two transfers of 60 from a balance of 100: one succeeds, one is recovery-logged")
        void racingTransfers_OneWins() throws Exception {
            printTestHeader("Racing Transfers");
            long customerId = uniqueCustomer();
            Account sender = openAccount(customerId, "100.00");
            Account receiver = openAccount(uniqueCustomer(), "0.00");
            printInput("Sender balance", "100.00");
            printInput("Transfers", "2 x 60.00");

            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger succeeded = new AtomicInteger();
            List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
            for (int i = 0; i < 2; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        transferGateway.submitTransfer(customerId, sender.getId(), receiver.getAccountNumber(),
                            new BigDecimal("60.00"), null, null);
                        succeeded.incrementAndGet();
                    } catch (Throwable t) {
                        failures.add(t);
                    }
                    return null;
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(60, TimeUnit.SECONDS));

            printOutput("Succeeded", succeeded.get());
            printOutput("Failures", failures);
            assertEquals(1, succeeded.get());
            assertEquals(1, failures.size());
            assertInstanceOf(InsufficientFundsException.class, failures.get(0));
            assertEquals(0, new BigDecimal("40.00").compareTo(balanceOf(sender)));
            assertEquals(0, new BigDecimal("60.00").compareTo(balanceOf(receiver)));

            List<RecoveryLogEntry> entries = recoveryRecorder.findBySender(sender.getId(), 10);
            assertEquals(1, entries.size());
            assertEquals(TransferFailureKind.INSUFFICIENT_FUNDS, entries.get(0).getFailureKind());
            assertEquals(0, new BigDecimal("40.00").compareTo(entries.get(0).getSenderBalanceAtFailure()));
            printSuccess("Exactly one transfer won the race");
        }

        @Test
        @DisplayName("Random transfers among four accounts conserve the total")
        void randomTransfers_Conserved() throws Exception {
            printTestHeader("Conservation Under Load");
            long customerId = uniqueCustomer();
            List<Account> accounts = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                accounts.add(openAccount(customerId, "250.00"));
            }
            int transfers = 200;
            printInput("Transfers", transfers);

            ExecutorService executor = Executors.newFixedThreadPool(8);
            List<Throwable> unexpected = Collections.synchronizedList(new ArrayList<>());
            AtomicInteger succeeded = new AtomicInteger();
            for (int i = 0; i < transfers; i++) {
                executor.submit(() -> {
                    ThreadLocalRandom random = ThreadLocalRandom.current();
                    Account from = accounts.get(random.nextInt(accounts.size()));
                    Account to = accounts.get(random.nextInt(accounts.size()));
                    BigDecimal amount = BigDecimal.valueOf(random.nextInt(1, 10_000), 2);
                    try {
                        transferEngine.transfer(from.getId(), to.getId(), amount, null, null);
                        succeeded.incrementAndGet();
                    } catch (TransferException e) {
                        TransferFailureKind kind = e.getKind();
                        if (kind != TransferFailureKind.INSUFFICIENT_FUNDS
                                && kind != TransferFailureKind.SAME_ACCOUNT
                                && kind != TransferFailureKind.CONCURRENCY_CONFLICT) {
                            unexpected.add(e);
                        }
                    } catch (Throwable t) {
                        unexpected.add(t);
                    }
                });
            }
            executor.shutdown();
            assertTrue(executor.awaitTermination(120, TimeUnit.SECONDS));

            BigDecimal total = BigDecimal.ZERO;
            for (Account account : accounts) {
                BigDecimal balance = balanceOf(account);
                assertTrue(balance.signum() >= 0, "Negative balance on " + account.getAccountNumber());
                total = total.add(balance);
            }
            printOutput("Succeeded", succeeded.get());
            printOutput("Total", total);
            assertTrue(unexpected.isEmpty(), "Unexpected failures: " + unexpected);
            assertEquals(0, new BigDecimal("1000.00").compareTo(total));
            printSuccess("Total conserved");
        }
    }

    @Nested
    @DisplayName("Lock timeouts")
    class LockTimeouts {

        @Test
        @DisplayName("A long-held row lock ends in CONCURRENCY_CONFLICT with no balance change")
        void heldLock_ConcurrencyConflict() throws Exception {
            printTestHeader("Lock Timeout");
            long customerId = uniqueCustomer();
            Account sender = openAccount(customerId, "100.00");
            Account receiver = openAccount(uniqueCustomer(), "0.00");

            CountDownLatch locked = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ExecutorService holder = Executors.newSingleThreadExecutor();
            holder.submit(() -> new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
                accountStore.lockById(sender.getId());
                locked.countDown();
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));

            try {
                assertTrue(locked.await(10, TimeUnit.SECONDS));

                ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class,
                    () -> transferGateway.submitTransfer(customerId, sender.getId(), receiver.getAccountNumber(),
                        new BigDecimal("10.00"), null, null));
                printOutput("Error", e.getMessage());
                assertEquals(2, e.getDetails().get("attempts"));
            } finally {
                release.countDown();
                holder.shutdown();
                assertTrue(holder.awaitTermination(30, TimeUnit.SECONDS));
            }

            assertEquals(0, new BigDecimal("100.00").compareTo(balanceOf(sender)));
            assertEquals(0, new BigDecimal("0.00").compareTo(balanceOf(receiver)));
            assertEquals(0, transactionRepository.countByAccount(sender.getId()));
            List<RecoveryLogEntry> entries = recoveryRecorder.findBySender(sender.getId(), 10);
            assertEquals(1, entries.size());
            assertEquals(TransferFailureKind.CONCURRENCY_CONFLICT, entries.get(0).getFailureKind());
            printSuccess("Conflict reported after the retry budget");
        }
    }

    @Nested
    @DisplayName("Database constraints")
    class Constraints {

        @Test
        @DisplayName("Direct write of a negative balance is rejected by the database")
        void negativeBalance_Rejected() {
            Account account = openAccount(uniqueCustomer(), "5.00");

            assertThrows(DataIntegrityViolationException.class,
                () -> jdbcTemplate.update("UPDATE accounts SET balance = -1.00 WHERE id = ?", account.getId()));
            assertEquals(0, new BigDecimal("5.00").compareTo(balanceOf(account)));
        }
    }
}
