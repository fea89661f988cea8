package com.flagship.retail_banking.transfer;

import com.flagship.retail_banking.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps client idempotency keys to committed transaction ids.
 *
 * Strategy:
 * 1. Try Redis first (fast, but may be unavailable)
 * 2. Fall back to the transactions table, whose unique idempotency_key column
 *    is the source of truth
 * 3. Cache database hits in Redis for later lookups
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:transfer:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final TransactionRepository transactionRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(TransactionRepository transactionRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.transactionRepository = transactionRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Looks up the transaction committed under this key.
     *
     * @return the transaction id, or empty if the key has not been used
     * @throws StoreUnavailableException if the database lookup fails
     */
    public Optional<Long> findTransactionId(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(Long.parseLong(cached));
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            }
        }

        Optional<TransferRecord> existing;
        try {
            existing = transactionRepository.findByIdempotencyKey(idempotencyKey);
        } catch (DataAccessException e) {
            log.error("Database lookup failed for idempotency key {}: {}", idempotencyKey, e.getMessage());
            throw new StoreUnavailableException(e);
        }

        existing.ifPresent(record -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, record.getId());
        });
        return existing.map(TransferRecord::getId);
    }

    /**
     * Caches a key after its transaction committed. The database row already holds the key.
     */
    public void remember(String idempotencyKey, long transactionId) {
        requireKey(idempotencyKey);
        cache(idempotencyKey, transactionId);
    }

    private void cache(String idempotencyKey, long transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue()
                .set(REDIS_KEY_PREFIX + idempotencyKey, String.valueOf(transactionId), REDIS_TTL);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
