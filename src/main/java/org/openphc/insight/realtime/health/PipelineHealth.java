package org.openphc.insight.realtime.health;

import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.domain.model.enums.HealthStatus;
import org.openphc.insight.realtime.domain.model.enums.SourceState;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Aggregates the signals that decide whether the pipeline is healthy: upstream connectivity,
 * backlog eviction pressure and replay failures.
 */
@Component
@Slf4j
public class PipelineHealth {

    private final Clock clock;
    private final int degradedAfterAttempts;
    private final int degradedEvictionPasses;
    private final int degradedReplayFailures;
    private final Duration replayFailureWindow;

    private SourceState sourceState = SourceState.STOPPED;
    private int upstreamFailures;
    private int hardEvictionPasses;
    private final Deque<Instant> replayFailures = new ArrayDeque<>();
    private HealthStatus lastReported;

    public PipelineHealth(RealtimeProperties properties, Clock clock) {
        this.clock = clock;
        this.degradedAfterAttempts = properties.getSource().getDegradedAfterAttempts();
        this.degradedEvictionPasses = properties.getHealth().getDegradedEvictionPasses();
        this.degradedReplayFailures = properties.getHealth().getDegradedReplayFailures();
        this.replayFailureWindow = properties.getHealth().getReplayFailureWindow();
    }

    public synchronized void sourceState(SourceState state) {
        this.sourceState = state;
        if (state == SourceState.CONNECTED) {
            upstreamFailures = 0;
        }
        logTransition();
    }

    public synchronized void upstreamFailure() {
        upstreamFailures++;
        logTransition();
    }

    public synchronized void evictionPass(boolean hardBoundHit) {
        hardEvictionPasses = hardBoundHit ? hardEvictionPasses + 1 : 0;
        logTransition();
    }

    public synchronized void replayFailure() {
        replayFailures.addLast(clock.instant());
        logTransition();
    }

    public synchronized HealthReport report() {
        Instant now = clock.instant();
        pruneReplayFailures(now);
        HealthStatus status;
        String reason = null;
        if (sourceState == SourceState.STOPPED) {
            status = HealthStatus.STOPPED;
        } else if (upstreamFailures >= degradedAfterAttempts) {
            status = HealthStatus.DEGRADED;
            reason = "upstream unreachable after " + upstreamFailures + " attempts";
        } else if (hardEvictionPasses >= degradedEvictionPasses) {
            status = HealthStatus.DEGRADED;
            reason = "backlog eviction pressure for " + hardEvictionPasses + " passes";
        } else if (replayFailures.size() >= degradedReplayFailures) {
            status = HealthStatus.DEGRADED;
            reason = replayFailures.size() + " replay failures within " + replayFailureWindow;
        } else if (sourceState == SourceState.RECONNECTING) {
            status = HealthStatus.RECONNECTING;
        } else {
            status = HealthStatus.CONNECTED;
        }
        return new HealthReport(status, reason, sourceState, upstreamFailures,
                hardEvictionPasses, replayFailures.size(), now);
    }

    private void pruneReplayFailures(Instant now) {
        Instant cutoff = now.minus(replayFailureWindow);
        while (!replayFailures.isEmpty() && replayFailures.peekFirst().isBefore(cutoff)) {
            replayFailures.pollFirst();
        }
    }

    private void logTransition() {
        HealthReport report = report();
        if (report.status() != lastReported) {
            if (report.status() == HealthStatus.DEGRADED) {
                log.warn("Pipeline health {} -> DEGRADED: {}", lastReported, report.reason());
            } else {
                log.info("Pipeline health {} -> {}", lastReported, report.status());
            }
            lastReported = report.status();
        }
    }
}
