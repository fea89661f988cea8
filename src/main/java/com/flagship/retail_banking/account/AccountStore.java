package com.flagship.retail_banking.account;

import com.flagship.retail_banking.exception.AccountInactiveException;
import com.flagship.retail_banking.exception.AccountNotFoundException;
import com.flagship.retail_banking.exception.InsufficientFundsException;
import com.flagship.retail_banking.exception.InvalidAmountException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of accounts and their balances.
 *
 * This store enforces the core account invariants:
 * 1. Balances never go below zero (checked here and by a CHECK constraint)
 * 2. Only ACTIVE accounts can be mutated
 * 3. Balance writes happen only inside a caller-owned transaction
 *
 * Balance-critical paths use JDBC directly so the locking SQL is explicit.
 */
@Service
@Slf4j
public class AccountStore {

    private static final String SELECT_ACCOUNT =
        "SELECT id, account_number, account_type, balance, customer_id, branch_id, status, opened_at, updated_at " +
        "FROM accounts";

    /** Largest balance the NUMERIC(15,2) column can hold. */
    public static final BigDecimal MAX_BALANCE = new BigDecimal("9999999999999.99");

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public AccountStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Opens a new ACTIVE account.
     *
     * @throws IllegalArgumentException if the number is taken or the initial balance is out of range
     */
    @Transactional
    public Account open(String accountNumber, AccountType accountType, long customerId,
                        long branchId, BigDecimal initialBalance) {
        if (accountNumber == null || accountNumber.isBlank()) {
            throw new IllegalArgumentException("Account number is required");
        }
        if (accountType == null) {
            throw new IllegalArgumentException("Account type is required");
        }
        BigDecimal opening = initialBalance != null ? initialBalance : BigDecimal.ZERO;
        if (opening.signum() < 0) {
            throw new IllegalArgumentException("Initial balance cannot be negative");
        }
        if (opening.compareTo(MAX_BALANCE) > 0) {
            throw new IllegalArgumentException("Initial balance cannot exceed " + MAX_BALANCE);
        }

        Timestamp now = Timestamp.from(clock.instant());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(con -> {
                PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO accounts (account_number, account_type, balance, customer_id, branch_id, " +
                    "status, opened_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                    new String[] {"id"});
                ps.setString(1, accountNumber);
                ps.setString(2, accountType.name());
                ps.setBigDecimal(3, opening);
                ps.setLong(4, customerId);
                ps.setLong(5, branchId);
                ps.setString(6, AccountStatus.ACTIVE.name());
                ps.setTimestamp(7, now);
                ps.setTimestamp(8, now);
                return ps;
            }, keyHolder);
        } catch (DuplicateKeyException e) {
            throw new IllegalArgumentException("Account number already exists: " + accountNumber, e);
        }

        long id = keyHolder.getKey().longValue();
        log.info("Opened {} account {} (id={}) for customer {}", accountType, accountNumber, id, customerId);
        return getById(id);
    }

    @Transactional(readOnly = true)
    public Optional<Account> findById(long accountId) {
        return jdbcTemplate.query(SELECT_ACCOUNT + " WHERE id = ?", accountRowMapper(), accountId)
            .stream()
            .findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<Account> findByNumber(String accountNumber) {
        return jdbcTemplate.query(SELECT_ACCOUNT + " WHERE account_number = ?", accountRowMapper(), accountNumber)
            .stream()
            .findFirst();
    }

    /**
     * @throws AccountNotFoundException if no account has this id
     */
    @Transactional(readOnly = true)
    public Account getById(long accountId) {
        return findById(accountId).orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    @Transactional(readOnly = true)
    public List<Account> findByCustomer(long customerId) {
        return jdbcTemplate.query(SELECT_ACCOUNT + " WHERE customer_id = ? ORDER BY id",
            accountRowMapper(), customerId);
    }

    /**
     * Reads an account and takes an exclusive row lock held until the surrounding
     * transaction ends. Blocks at most for the connection's lock timeout.
     *
     * @throws AccountNotFoundException if no account has this id
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Account lockById(long accountId) {
        return jdbcTemplate.query(SELECT_ACCOUNT + " WHERE id = ? FOR UPDATE", accountRowMapper(), accountId)
            .stream()
            .findFirst()
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    /**
     * Adds a signed amount to an account balance.
     *
     * The UPDATE is conditional on the row's current state, so a debit that
     * would overdraw the account changes nothing even if the caller skipped the lock.
     *
     * @param accountId account to change
     * @param signedAmount positive to credit, negative to debit
     * @return old and new balance
     * @throws AccountNotFoundException if the account does not exist
     * @throws AccountInactiveException if the account is not ACTIVE
     * @throws InsufficientFundsException if the result would be negative
     * @throws InvalidAmountException if the result would exceed {@link #MAX_BALANCE}
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceChange applyDelta(long accountId, BigDecimal signedAmount) {
        int updated = jdbcTemplate.update(
            "UPDATE accounts SET balance = balance + ?, updated_at = ? " +
            "WHERE id = ? AND status = ? AND balance + ? >= 0 AND balance + ? <= ?",
            signedAmount,
            Timestamp.from(clock.instant()),
            accountId,
            AccountStatus.ACTIVE.name(),
            signedAmount,
            signedAmount,
            MAX_BALANCE
        );

        if (updated == 0) {
            throw rejectionFor(accountId, signedAmount);
        }

        BigDecimal newBalance = jdbcTemplate.queryForObject(
            "SELECT balance FROM accounts WHERE id = ?", BigDecimal.class, accountId);
        BalanceChange change = new BalanceChange(accountId, newBalance.subtract(signedAmount), newBalance);
        log.debug("Applied {} to account {}: {} -> {}",
            signedAmount, accountId, change.getOldBalance(), change.getNewBalance());
        return change;
    }

    /**
     * Changes an account's status. Closing requires a zero balance.
     */
    @Transactional
    public Account updateStatus(long accountId, AccountStatus status) {
        Account account = lockById(accountId);
        if (status == AccountStatus.CLOSED && account.getBalance().signum() != 0) {
            throw new IllegalStateException(
                String.format("Cannot close account %s with non-zero balance %s",
                    account.getAccountNumber(), account.getBalance()));
        }
        jdbcTemplate.update("UPDATE accounts SET status = ?, updated_at = ? WHERE id = ?",
            status.name(), Timestamp.from(clock.instant()), accountId);
        log.info("Account {} status changed: {} -> {}", account.getAccountNumber(), account.getStatus(), status);
        return getById(accountId);
    }

    private RuntimeException rejectionFor(long accountId, BigDecimal signedAmount) {
        Account account = findById(accountId).orElse(null);
        if (account == null) {
            return new AccountNotFoundException(accountId);
        }
        if (!account.isActive()) {
            return new AccountInactiveException(accountId, account.getAccountNumber(), account.getStatus());
        }
        if (account.getBalance().add(signedAmount).compareTo(MAX_BALANCE) > 0) {
            return new InvalidAmountException(signedAmount.abs(),
                "balance of account " + account.getAccountNumber() + " would exceed " + MAX_BALANCE);
        }
        return new InsufficientFundsException(
            accountId, account.getAccountNumber(), signedAmount.negate(), account.getBalance());
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getLong("id"),
            rs.getString("account_number"),
            AccountType.valueOf(rs.getString("account_type")),
            rs.getBigDecimal("balance"),
            rs.getLong("customer_id"),
            rs.getLong("branch_id"),
            AccountStatus.valueOf(rs.getString("status")),
            rs.getTimestamp("opened_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
        );
    }
}
