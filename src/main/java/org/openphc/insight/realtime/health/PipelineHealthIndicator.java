package org.openphc.insight.realtime.health;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Publishes pipeline health under {@code /actuator/health}.
 */
@Component("pipeline")
@RequiredArgsConstructor
public class PipelineHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED");
    static final Status RECONNECTING = new Status("RECONNECTING");

    private final PipelineHealth pipelineHealth;

    @Override
    public Health health() {
        HealthReport report = pipelineHealth.report();
        Health.Builder builder = switch (report.status()) {
            case CONNECTED -> Health.up();
            case RECONNECTING -> Health.status(RECONNECTING);
            case DEGRADED -> Health.status(DEGRADED).withDetail("reason", report.reason());
            case STOPPED -> Health.down();
        };
        return builder
                .withDetail("source", report.sourceState())
                .withDetail("upstreamFailures", report.consecutiveUpstreamFailures())
                .withDetail("hardEvictionPasses", report.consecutiveHardEvictionPasses())
                .withDetail("recentReplayFailures", report.recentReplayFailures())
                .build();
    }
}
