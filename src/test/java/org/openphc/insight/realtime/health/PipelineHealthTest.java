package org.openphc.insight.realtime.health;

import org.junit.jupiter.api.Test;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.domain.model.enums.HealthStatus;
import org.openphc.insight.realtime.domain.model.enums.SourceState;
import org.openphc.insight.realtime.support.MutableClock;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PipelineHealthTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
    private final PipelineHealth health = new PipelineHealth(new RealtimeProperties(), clock);

    @Test
    void shouldStartStopped() {
        assertEquals(HealthStatus.STOPPED, health.report().status());
    }

    @Test
    void shouldReportConnectedAndReconnecting() {
        health.sourceState(SourceState.CONNECTED);
        assertEquals(HealthStatus.CONNECTED, health.report().status());

        health.sourceState(SourceState.RECONNECTING);
        health.upstreamFailure();
        assertEquals(HealthStatus.RECONNECTING, health.report().status());
        assertNull(health.report().reason());
    }

    @Test
    void shouldDegradeAfterRepeatedUpstreamFailures() {
        health.sourceState(SourceState.RECONNECTING);
        for (int i = 0; i < 5; i++) {
            health.upstreamFailure();
        }

        HealthReport report = health.report();
        assertEquals(HealthStatus.DEGRADED, report.status());
        assertTrue(report.reason().contains("upstream"));

        health.sourceState(SourceState.CONNECTED);
        assertEquals(HealthStatus.CONNECTED, health.report().status());
        assertEquals(0, health.report().consecutiveUpstreamFailures());
    }

    @Test
    void shouldDegradeOnSustainedEvictionPressureOnly() {
        health.sourceState(SourceState.CONNECTED);
        health.evictionPass(true);
        health.evictionPass(true);
        health.evictionPass(false);
        health.evictionPass(true);
        assertEquals(HealthStatus.CONNECTED, health.report().status());

        health.evictionPass(true);
        health.evictionPass(true);
        assertEquals(HealthStatus.DEGRADED, health.report().status());
        assertTrue(health.report().reason().contains("eviction"));
    }

    @Test
    void shouldForgetReplayFailuresOutsideWindow() {
        health.sourceState(SourceState.CONNECTED);
        for (int i = 0; i < 5; i++) {
            health.replayFailure();
        }
        assertEquals(HealthStatus.DEGRADED, health.report().status());

        clock.advance(Duration.ofMinutes(6));

        assertEquals(HealthStatus.CONNECTED, health.report().status());
        assertEquals(0, health.report().recentReplayFailures());
    }
}
