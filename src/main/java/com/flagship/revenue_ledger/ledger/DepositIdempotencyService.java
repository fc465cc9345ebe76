package com.flagship.revenue_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Deposit idempotency keys: Redis fast path, database as the source of truth.
 *
 * A Redis hit only short-circuits the lookup; {@link LedgerService} still
 * re-checks the database under the ledger lock before applying a deposit, so
 * a stale or missing Redis entry can never cause a double deposit.
 */
@Service
@Slf4j
public class DepositIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "deposit-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerDepositRepository depositRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public DepositIdempotencyService(LedgerDepositRepository depositRepository,
                                     Optional<StringRedisTemplate> redisTemplate) {
        this.depositRepository = depositRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return id of the deposit already recorded under this key, if any
     */
    public Optional<UUID> checkIdempotencyKey(String ledgerAddress, String idempotencyKey) {
        requireKey(idempotencyKey);
        String redisKey = redisKey(ledgerAddress, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String depositId = redisTemplate.get().opsForValue().get(redisKey);
                if (depositId != null) {
                    log.debug("Deposit idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(depositId));
                }
            } catch (DataAccessException e) {
                log.warn("Redis lookup failed for deposit key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> existing = depositRepository
                .findByLedgerAddressAndIdempotencyKey(ledgerAddress, idempotencyKey)
                .map(LedgerDepositEntity::getId);
        existing.ifPresent(id -> cache(redisKey, id));
        return existing;
    }

    /**
     * Caches the key after the deposit row has been written. Best effort.
     */
    public void storeIdempotencyKey(String ledgerAddress, String idempotencyKey, UUID depositId) {
        requireKey(idempotencyKey);
        if (depositId == null) {
            throw new IllegalArgumentException("Deposit id cannot be null");
        }
        cache(redisKey(ledgerAddress, idempotencyKey), depositId);
    }

    private void cache(String redisKey, UUID depositId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, depositId.toString(), REDIS_TTL);
        } catch (DataAccessException e) {
            log.warn("Failed to cache deposit idempotency key {}: {}", redisKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }

    private static String redisKey(String ledgerAddress, String idempotencyKey) {
        return REDIS_KEY_PREFIX + ledgerAddress + ":" + idempotencyKey;
    }
}
