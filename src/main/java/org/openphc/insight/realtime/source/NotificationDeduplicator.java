package org.openphc.insight.realtime.source;

import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.backlog.ReplayStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Two-layer deduplication of upstream notifications by change id: Redis fast path with a TTL,
 * then the backlog (authoritative while the entry is retained).
 */
@Service
@Slf4j
public class NotificationDeduplicator {

    private static final String KEY_PREFIX = "notification:";

    private final StringRedisTemplate redisTemplate;
    private final ReplayStore replayStore;
    private final boolean redisEnabled;
    private final Duration ttl;

    public NotificationDeduplicator(StringRedisTemplate redisTemplate,
                                    ReplayStore replayStore,
                                    @Value("${insight.source.dedup.redis-enabled:true}") boolean redisEnabled,
                                    @Value("${insight.source.dedup.ttl-hours:24}") long ttlHours) {
        this.redisTemplate = redisTemplate;
        this.replayStore = replayStore;
        this.redisEnabled = redisEnabled;
        this.ttl = Duration.ofHours(ttlHours);
    }

    public boolean isDuplicate(String sourceId, String changeId) {
        if (changeId == null) {
            return false;
        }
        if (isDuplicateViaRedis(sourceId, changeId)) {
            return true;
        }
        try {
            boolean exists = replayStore.containsChange(changeId);
            if (exists) {
                log.info("Duplicate detected via backlog: source={}, change={}", sourceId, changeId);
            }
            return exists;
        } catch (DataAccessException e) {
            log.warn("Backlog dedup check failed, accepting change {}: {}", changeId, e.getMessage());
            return false;
        }
    }

    public void markAsProcessed(String sourceId, String changeId) {
        if (!redisEnabled || changeId == null) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(buildKey(sourceId, changeId), "1", ttl);
        } catch (DataAccessException e) {
            log.warn("Failed to set Redis dedup key: {}", e.getMessage());
        }
    }

    private boolean isDuplicateViaRedis(String sourceId, String changeId) {
        if (!redisEnabled) {
            return false;
        }
        try {
            if (Boolean.TRUE.equals(redisTemplate.hasKey(buildKey(sourceId, changeId)))) {
                log.info("Duplicate detected via Redis: source={}, change={}", sourceId, changeId);
                return true;
            }
        } catch (DataAccessException e) {
            log.warn("Redis dedup check failed, falling back to backlog: {}", e.getMessage());
        }
        return false;
    }

    private String buildKey(String sourceId, String changeId) {
        return KEY_PREFIX + sourceId + ":" + changeId;
    }
}
