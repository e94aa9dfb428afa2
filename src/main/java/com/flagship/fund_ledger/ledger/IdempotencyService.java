package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.ledger.exception.ValidationException;
import com.flagship.fund_ledger.ledger.store.TransactionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps a client's Idempotency-Key to the transaction it created.
 *
 * Redis is the fast path; the {@code idempotency_key} column of the transaction row
 * (unique per owner) is the source of truth and is consulted whenever Redis misses
 * or is unavailable. Keys are scoped by owner.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger:idempotency:";
    private static final int MAX_KEY_LENGTH = 255;

    private final TransactionRepository transactionRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final Duration ttl;

    public IdempotencyService(TransactionRepository transactionRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate,
                              @Value("${ledger.idempotency.ttl:7d}") Duration ttl) {
        this.transactionRepository = transactionRepository;
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    /**
     * @return the transaction already created under this key, if any
     */
    public Optional<UUID> findTransactionId(UUID ownerId, String idempotencyKey) {
        validateKey(idempotencyKey);
        String redisKey = redisKey(ownerId, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(redisKey);
                if (cached != null) {
                    log.debug("Idempotency key {} resolved from Redis", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, using database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = transactionRepository.findIdByIdempotencyKey(ownerId, idempotencyKey);
        stored.ifPresent(transactionId -> cache(redisKey, transactionId));
        return stored;
    }

    /**
     * Caches the mapping after the transaction row (which carries the key) was written.
     * Best effort: a Redis failure only costs a database lookup later.
     */
    public void remember(UUID ownerId, String idempotencyKey, UUID transactionId) {
        validateKey(idempotencyKey);
        cache(redisKey(ownerId, idempotencyKey), transactionId);
    }

    private void cache(String redisKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, transactionId.toString(), ttl);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }

    private static String redisKey(UUID ownerId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + ownerId + ":" + idempotencyKey;
    }

    private static void validateKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new ValidationException("Idempotency key must not be blank");
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new ValidationException("Idempotency key longer than " + MAX_KEY_LENGTH + " characters");
        }
    }
}
