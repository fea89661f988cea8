package com.flagship.retail_banking.transfer;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to the transactions table. Rows are inserted once and never updated.
 */
@Component
public class TransactionRepository {

    private static final String SELECT_TRANSACTION =
        "SELECT id, transaction_type, amount, sender_account_id, receiver_account_id, status, description, " +
        "idempotency_key, created_at FROM transactions";

    private final JdbcTemplate jdbcTemplate;

    public TransactionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Inserts a COMPLETED transaction inside the caller's unit of work.
     * A reused idempotency key fails with DuplicateKeyException, rolling the whole unit back.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TransferRecord insert(TransactionType type, BigDecimal amount, Long senderAccountId,
                                 Long receiverAccountId, String description, String idempotencyKey,
                                 Instant createdAt) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                "INSERT INTO transactions (transaction_type, amount, sender_account_id, receiver_account_id, " +
                "status, description, idempotency_key, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                new String[] {"id"});
            ps.setString(1, type.name());
            ps.setBigDecimal(2, amount);
            setNullableLong(ps, 3, senderAccountId);
            setNullableLong(ps, 4, receiverAccountId);
            ps.setString(5, TransactionStatus.COMPLETED.name());
            ps.setString(6, description);
            ps.setString(7, idempotencyKey);
            ps.setTimestamp(8, Timestamp.from(createdAt));
            return ps;
        }, keyHolder);

        return new TransferRecord(
            keyHolder.getKey().longValue(),
            type,
            amount,
            senderAccountId,
            receiverAccountId,
            TransactionStatus.COMPLETED,
            description,
            idempotencyKey,
            createdAt
        );
    }

    @Transactional(readOnly = true)
    public Optional<TransferRecord> findById(long transactionId) {
        return jdbcTemplate.query(SELECT_TRANSACTION + " WHERE id = ?", transactionRowMapper(), transactionId)
            .stream()
            .findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<TransferRecord> findByIdempotencyKey(String idempotencyKey) {
        return jdbcTemplate.query(SELECT_TRANSACTION + " WHERE idempotency_key = ?",
                transactionRowMapper(), idempotencyKey)
            .stream()
            .findFirst();
    }

    /**
     * Transactions where the account is sender or receiver, newest first.
     */
    @Transactional(readOnly = true)
    public List<TransferRecord> findByAccount(long accountId, int limit) {
        return jdbcTemplate.query(
            SELECT_TRANSACTION + " WHERE sender_account_id = ? OR receiver_account_id = ? " +
            "ORDER BY created_at DESC, id DESC LIMIT ?",
            transactionRowMapper(), accountId, accountId, limit);
    }

    @Transactional(readOnly = true)
    public long countByAccount(long accountId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transactions WHERE sender_account_id = ? OR receiver_account_id = ?",
            Long.class, accountId, accountId);
        return count != null ? count : 0L;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }

    private RowMapper<TransferRecord> transactionRowMapper() {
        return (rs, rowNum) -> new TransferRecord(
            rs.getLong("id"),
            TransactionType.valueOf(rs.getString("transaction_type")),
            rs.getBigDecimal("amount"),
            rs.getObject("sender_account_id", Long.class),
            rs.getObject("receiver_account_id", Long.class),
            TransactionStatus.valueOf(rs.getString("status")),
            rs.getString("description"),
            rs.getString("idempotency_key"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
