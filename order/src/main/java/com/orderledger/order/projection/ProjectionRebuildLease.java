package com.orderledger.order.projection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Cluster-wide rebuild guard: Redis-backed lease per projection.
 *
 * Key format:  orderledger:projection-rebuild:{projection}
 * Value:       id of the owning instance
 * TTL:         renewed after every replayed batch, so a crashed owner frees the lease on its own
 *
 * Redis SET NX is atomic, so at most one instance holds the lease at a time.
 * Release only deletes the key if this instance still owns it.
 */
@Slf4j
@Component
public class ProjectionRebuildLease {

    private static final String KEY_PREFIX = "orderledger:projection-rebuild:";

    private static final RedisScript<Long> RELEASE_IF_OWNER = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;
    private final String ownerId = UUID.randomUUID().toString();

    public ProjectionRebuildLease(StringRedisTemplate redisTemplate,
                                  @Value("${orderledger.projections.rebuild.lease-ttl-seconds:300}") long ttlSeconds) {
        this.redisTemplate = redisTemplate;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    /**
     * @return true if this instance now holds the lease
     */
    public boolean acquire(ProjectionKind kind) {
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key(kind), ownerId, ttl);
        if (!Boolean.TRUE.equals(acquired)) {
            log.info("Rebuild lease held elsewhere: projection={}", kind.getIdentifier());
            return false;
        }
        return true;
    }

    public void renew(ProjectionKind kind) {
        if (ownerId.equals(redisTemplate.opsForValue().get(key(kind)))) {
            redisTemplate.expire(key(kind), ttl);
        } else {
            log.warn("Rebuild lease lost while rebuilding: projection={}", kind.getIdentifier());
        }
    }

    public void release(ProjectionKind kind) {
        redisTemplate.execute(RELEASE_IF_OWNER, List.of(key(kind)), ownerId);
    }

    private static String key(ProjectionKind kind) {
        return KEY_PREFIX + kind.getIdentifier();
    }
}
