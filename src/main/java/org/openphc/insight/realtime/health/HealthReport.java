package org.openphc.insight.realtime.health;

import org.openphc.insight.realtime.domain.model.enums.HealthStatus;
import org.openphc.insight.realtime.domain.model.enums.SourceState;

import java.time.Instant;

/**
 * Pipeline health at one instant. {@code reason} is set only when degraded.
 */
public record HealthReport(HealthStatus status,
                           String reason,
                           SourceState sourceState,
                           int consecutiveUpstreamFailures,
                           int consecutiveHardEvictionPasses,
                           int recentReplayFailures,
                           Instant at) {
}
