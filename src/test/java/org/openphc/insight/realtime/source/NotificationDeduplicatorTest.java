package org.openphc.insight.realtime.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.openphc.insight.realtime.backlog.ReplayStore;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationDeduplicatorTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private ReplayStore replayStore;

    private NotificationDeduplicator deduplicator(boolean redisEnabled) {
        return new NotificationDeduplicator(redisTemplate, replayStore, redisEnabled, 24);
    }

    @Test
    void shouldDetectDuplicateViaRedis() {
        when(redisTemplate.hasKey("notification:primary:c-1")).thenReturn(true);

        assertTrue(deduplicator(true).isDuplicate("primary", "c-1"));
        verify(replayStore, never()).containsChange("c-1");
    }

    @Test
    void shouldFallBackToBacklogWhenRedisFails() {
        when(redisTemplate.hasKey("notification:primary:c-1"))
                .thenThrow(new RedisConnectionFailureException("down"));
        when(replayStore.containsChange("c-1")).thenReturn(true);

        assertTrue(deduplicator(true).isDuplicate("primary", "c-1"));
    }

    @Test
    void shouldAcceptWhenBothLayersFail() {
        when(redisTemplate.hasKey("notification:primary:c-1"))
                .thenThrow(new RedisConnectionFailureException("down"));
        when(replayStore.containsChange("c-1")).thenThrow(new QueryTimeoutException("slow"));

        assertFalse(deduplicator(true).isDuplicate("primary", "c-1"));
    }

    @Test
    void shouldSkipRedisWhenDisabled() {
        when(replayStore.containsChange("c-1")).thenReturn(false);
        NotificationDeduplicator deduplicator = deduplicator(false);

        assertFalse(deduplicator.isDuplicate("primary", "c-1"));
        deduplicator.markAsProcessed("primary", "c-1");

        verifyNoInteractions(redisTemplate);
    }

    @Test
    void shouldTreatMissingChangeIdAsUnique() {
        assertFalse(deduplicator(true).isDuplicate("primary", null));
        verifyNoInteractions(redisTemplate, replayStore);
    }

    @Test
    void shouldMarkProcessedWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        deduplicator(true).markAsProcessed("primary", "c-1");

        verify(valueOperations).set("notification:primary:c-1", "1", Duration.ofHours(24));
    }

    @Test
    void shouldSwallowRedisFailureOnMark() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOperations).set("notification:primary:c-1", "1", Duration.ofHours(24));

        assertDoesNotThrow(() -> deduplicator(true).markAsProcessed("primary", "c-1"));
    }
}
