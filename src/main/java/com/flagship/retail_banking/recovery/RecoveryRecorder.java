package com.flagship.retail_banking.recovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.retail_banking.observability.CorrelationContext;
import com.flagship.retail_banking.outbox.OutboxService;
import com.flagship.retail_banking.transfer.event.TransferFailedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists diagnostics for failed money movements.
 *
 * Each entry is written in its own transaction (REQUIRES_NEW), independent of
 * the failed unit of work, which has already rolled back. The TransferFailed
 * outbox event commits together with the entry.
 *
 * Callers treat this as best-effort: see {@code TransferGateway}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecoveryRecorder {

    static final String AGGREGATE_TYPE = "RecoveryLog";
    // Escaping can double the preview, so it stays well under the column limit
    private static final int PREVIEW_LENGTH = 1500;
    private static final int AMOUNT_COLUMN_SCALE = 2;
    private static final BigDecimal MAX_COLUMN_AMOUNT = new BigDecimal("9999999999999.99");

    private final RecoveryLogRepository repository;
    private final OutboxService outboxService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Persists a draft entry, assigning its id and failure time.
     *
     * @param draft entry without id or failedAt
     * @return the stored entry
     * @throws IllegalArgumentException if the draft lacks operation type, failure kind or reason
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RecoveryLogEntry record(RecoveryLogEntry draft) {
        if (draft.getOperationType() == null || draft.getFailureKind() == null) {
            throw new IllegalArgumentException("Recovery entry needs an operation type and a failure kind");
        }
        if (draft.getFailureReason() == null || draft.getFailureReason().isBlank()) {
            throw new IllegalArgumentException("Recovery entry needs a failure reason");
        }

        Map<String, Object> details = new LinkedHashMap<>();
        if (draft.getAdditionalDetails() != null) {
            details.putAll(draft.getAdditionalDetails());
        }
        // Values the NUMERIC(15,2) columns cannot hold move into the details as text
        BigDecimal attemptedAmount = draft.getAttemptedAmount();
        if (!fitsAmountColumn(attemptedAmount)) {
            details.put("attempted_amount_raw", attemptedAmount.toPlainString());
            attemptedAmount = null;
        }
        BigDecimal senderBalance = draft.getSenderBalanceAtFailure();
        if (!fitsAmountColumn(senderBalance)) {
            details.put("sender_balance_raw", senderBalance.toPlainString());
            senderBalance = null;
        }

        RecoveryLogEntry entry = draft.toBuilder()
            .id(UUID.randomUUID())
            .failedAt(clock.instant())
            .attemptedAmount(attemptedAmount)
            .senderBalanceAtFailure(senderBalance)
            .additionalDetails(details)
            .build();

        repository.save(RecoveryLogEntity.fromDomain(entry, serializeDetails(entry.getAdditionalDetails())));
        outboxService.saveEvent(AGGREGATE_TYPE, entry.getId().toString(), TransferFailedEvent.EVENT_TYPE,
            TransferFailedEvent.fromEntry(entry, CorrelationContext.getCorrelationId()));

        log.info("Recovery log {} written: operation={}, kind={}, sender={}, receiver={}, amount={}",
            entry.getId(), entry.getOperationType(), entry.getFailureKind(),
            entry.getSenderAccountId(), entry.getReceiverAccountId(), entry.getAttemptedAmount());
        return entry;
    }

    @Transactional(readOnly = true)
    public Optional<RecoveryLogEntry> findById(UUID id) {
        return repository.findById(id).map(this::toDomain);
    }

    /**
     * Most recent entries first.
     */
    @Transactional(readOnly = true)
    public List<RecoveryLogEntry> findAll(int limit) {
        return repository.findAllByOrderByFailedAtDesc(PageRequest.of(0, limit))
            .stream()
            .map(this::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<RecoveryLogEntry> findBySender(long senderAccountId, int limit) {
        return repository.findBySenderAccountIdOrderByFailedAtDesc(senderAccountId, PageRequest.of(0, limit))
            .stream()
            .map(this::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countBySender(long senderAccountId) {
        return repository.countBySenderAccountId(senderAccountId);
    }

    static boolean fitsAmountColumn(BigDecimal value) {
        if (value == null) {
            return true;
        }
        return value.stripTrailingZeros().scale() <= AMOUNT_COLUMN_SCALE
            && value.abs().compareTo(MAX_COLUMN_AMOUNT) <= 0;
    }

    private String serializeDetails(Map<String, Object> details) {
        try {
            String json = objectMapper.writeValueAsString(details);
            if (json.length() <= RecoveryLogEntity.MAX_DETAILS_LENGTH) {
                return json;
            }
            // Oversized details keep a prefix so the column limit is never hit
            Map<String, Object> truncated = new LinkedHashMap<>();
            truncated.put("truncated", true);
            truncated.put("preview", json.substring(0, PREVIEW_LENGTH));
            return objectMapper.writeValueAsString(truncated);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize recovery details", e);
        }
    }

    private RecoveryLogEntry toDomain(RecoveryLogEntity entity) {
        return entity.toDomain(parseDetails(entity.getId(), entity.getAdditionalDetails()));
    }

    private Map<String, Object> parseDetails(UUID id, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() { });
        } catch (JsonProcessingException e) {
            log.warn("Recovery log {} has unreadable details, returning raw text: {}", id, e.getMessage());
            return Map.of("raw", json);
        }
    }
}
