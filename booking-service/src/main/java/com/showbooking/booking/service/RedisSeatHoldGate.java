package com.showbooking.booking.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;

/**
 * Per-seat SET NX gate. When Redis is unreachable the gate stays open and the
 * database conditional update alone serializes contenders.
 */
@Service
@Slf4j
@ConditionalOnProperty(value = "booking.hold.gate.enabled", havingValue = "true", matchIfMissing = true)
public class RedisSeatHoldGate implements SeatHoldGate {

    // Only delete the key if it still carries our token
    private static final String RELEASE_GATE_LUA =
        "if redis.call('GET', KEYS[1]) == ARGV[1] then " +
        "  return redis.call('DEL', KEYS[1]) " +
        "else " +
        "  return 0 " +
        "end";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> releaseGateScript;

    public RedisSeatHoldGate(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.releaseGateScript = new DefaultRedisScript<>(RELEASE_GATE_LUA, Long.class);
    }

    @Override
    public boolean tryAcquire(Long showId, String seatLabel, String holdToken, Duration ttl) {
        String key = SeatHoldGate.seatHoldKey(showId, seatLabel);

        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, holdToken, ttl);

            if (Boolean.FALSE.equals(acquired)) {
                log.debug("Seat gate already claimed: {}", key);
                return false;
            }
            // null is returned inside pipelines/transactions; let the database decide
            log.debug("Seat gate claimed: {} by {}", key, holdToken);
            return true;
        } catch (Exception e) {
            log.warn("Redis unavailable, seat gate open for {}: {}", key, e.getMessage());
            return true;
        }
    }

    @Override
    public void release(Long showId, String seatLabel, String holdToken) {
        String key = SeatHoldGate.seatHoldKey(showId, seatLabel);

        try {
            Long result = redisTemplate.execute(
                releaseGateScript,
                Collections.singletonList(key),
                holdToken
            );

            if (result != null && result == 1) {
                log.debug("Seat gate released: {} by {}", key, holdToken);
            } else {
                log.debug("Seat gate {} not owned by {} (expired or never set)", key, holdToken);
            }
        } catch (Exception e) {
            // The key's TTL bounds how long a stale claim can block new holds
            log.warn("Failed to release seat gate {}: {}", key, e.getMessage());
        }
    }
}
