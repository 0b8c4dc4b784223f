package com.flagship.footy_marketplace.webhook;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis fast path for "have we seen this gateway event before".
 *
 * Only ever answers yes for events that were committed, and every Redis failure is
 * treated as a miss. The webhook_events table stays the source of truth.
 */
@Component
@Slf4j
public class WebhookIdempotencyCache {

    private static final String REDIS_KEY_PREFIX = "webhook:event:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean enabled;
    private final Duration ttl;

    public WebhookIdempotencyCache(Optional<StringRedisTemplate> redisTemplate,
                                   @Value("${idempotency.redis.enabled:true}") boolean enabled,
                                   @Value("${idempotency.redis.ttl:P7D}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.enabled = enabled;
        this.ttl = ttl;
    }

    public boolean isKnown(String eventId) {
        if (!isAvailable()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.get().hasKey(REDIS_KEY_PREFIX + eventId));
        } catch (Exception e) {
            log.warn("Redis lookup failed for webhook event {}, falling back to database: {}",
                eventId, e.getMessage());
            return false;
        }
    }

    public void remember(String eventId) {
        if (!isAvailable()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + eventId, "1", ttl);
        } catch (Exception e) {
            log.debug("Failed to cache webhook event {} in Redis: {}", eventId, e.getMessage());
        }
    }

    private boolean isAvailable() {
        return enabled && redisTemplate.isPresent();
    }
}
