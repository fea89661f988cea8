package com.flagship.retail_banking.audit;

import com.flagship.retail_banking.account.BalanceChange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;

/**
 * Appends audit rows for balance changes.
 *
 * Recording uses MANDATORY propagation: an audit row only ever exists
 * alongside the balance change it describes, and both roll back together.
 * There is no update or delete.
 */
@Service
@Slf4j
public class AuditRecorder {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public AuditRecorder(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Records one balance change inside the caller's transaction.
     *
     * @param change old and new balance of the account
     * @param operationType what caused the change
     * @param transactionReference id of the transaction row written in the same unit of work
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void record(BalanceChange change, AuditOperationType operationType, String transactionReference) {
        jdbcTemplate.update(
            "INSERT INTO audit_logs (account_id, old_balance, new_balance, operation_type, " +
            "transaction_reference, changed_at) VALUES (?, ?, ?, ?, ?, ?)",
            change.getAccountId(),
            change.getOldBalance(),
            change.getNewBalance(),
            operationType.name(),
            transactionReference,
            Timestamp.from(clock.instant())
        );
        log.debug("Audit: account {} {} {} -> {}",
            change.getAccountId(), operationType, change.getOldBalance(), change.getNewBalance());
    }

    /**
     * Audit trail of one account, newest first.
     */
    @Transactional(readOnly = true)
    public List<AuditLogEntry> findByAccount(long accountId) {
        return jdbcTemplate.query(
            "SELECT id, account_id, old_balance, new_balance, operation_type, transaction_reference, changed_at " +
            "FROM audit_logs WHERE account_id = ? ORDER BY changed_at DESC, id DESC",
            auditRowMapper(),
            accountId
        );
    }

    @Transactional(readOnly = true)
    public long countByAccount(long accountId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM audit_logs WHERE account_id = ?", Long.class, accountId);
        return count != null ? count : 0L;
    }

    private RowMapper<AuditLogEntry> auditRowMapper() {
        return (rs, rowNum) -> new AuditLogEntry(
            rs.getLong("id"),
            rs.getLong("account_id"),
            rs.getBigDecimal("old_balance"),
            rs.getBigDecimal("new_balance"),
            AuditOperationType.valueOf(rs.getString("operation_type")),
            rs.getString("transaction_reference"),
            rs.getTimestamp("changed_at").toInstant()
        );
    }
}
