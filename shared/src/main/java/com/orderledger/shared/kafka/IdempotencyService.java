package com.orderledger.shared.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Redis-backed deduplication for Kafka consumers.
 *
 * Delivery is at-least-once: a relay retry or a consumer rebalance can hand the same event
 * to a listener twice. The first delivery claims the event id with SET NX; later deliveries
 * find the key and are skipped.
 *
 * Key format:  orderledger:processed:{topic}:{eventId}
 * TTL:         24 hours
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private static final String KEY_PREFIX = "orderledger:processed:";
    private static final Duration DEFAULT_TTL = Duration.ofHours(24);

    private final StringRedisTemplate redisTemplate;

    /**
     * Claims the event for processing. Atomic.
     *
     * @return true if the event was claimed before (duplicate), false if this call claimed it
     */
    public boolean isDuplicate(String eventId, String topic) {
        Boolean isNew = redisTemplate.opsForValue().setIfAbsent(key(eventId, topic), "1", DEFAULT_TTL);

        if (Boolean.FALSE.equals(isNew)) {
            log.debug("Duplicate event detected and skipped: eventId={}, topic={}", eventId, topic);
            return true;
        }
        return false;
    }

    /**
     * Drops the claim, so a redelivery after a failed attempt is processed again.
     */
    public void release(String eventId, String topic) {
        redisTemplate.delete(key(eventId, topic));
    }

    private static String key(String eventId, String topic) {
        return KEY_PREFIX + topic + ":" + eventId;
    }
}
