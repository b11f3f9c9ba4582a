package org.openphc.insight.realtime.backlog;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.health.PipelineHealth;
import org.openphc.insight.realtime.subscription.SubscriptionRegistry;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Periodic backlog eviction. Soft bounds are held back by connected subscribers' cursors;
 * passes that needed the hard bounds count as eviction pressure.
 */
@Component
@Slf4j
public class BacklogEvictionJob {

    private final ReplayStore replayStore;
    private final RetentionPolicy retentionPolicy;
    private final SubscriptionRegistry registry;
    private final PipelineHealth health;
    private final Clock clock;
    private final Counter evicted;
    private final Counter hardScopes;

    public BacklogEvictionJob(ReplayStore replayStore,
                              RetentionPolicy retentionPolicy,
                              SubscriptionRegistry registry,
                              PipelineHealth health,
                              Clock clock,
                              MeterRegistry meterRegistry) {
        this.replayStore = replayStore;
        this.retentionPolicy = retentionPolicy;
        this.registry = registry;
        this.health = health;
        this.clock = clock;
        this.evicted = Counter.builder("insight.backlog.evicted").tag("bound", "any").register(meterRegistry);
        this.hardScopes = Counter.builder("insight.backlog.evicted").tag("bound", "hard").register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${insight.backlog.eviction-interval-ms:30000}",
            initialDelayString = "${insight.backlog.eviction-interval-ms:30000}")
    public EvictionReport evict() {
        EvictionReport report = replayStore.evict(retentionPolicy, registry.minCursorByScope(),
                OffsetDateTime.now(clock));
        evicted.increment(report.entriesEvicted());
        hardScopes.increment(report.hardBoundScopes());
        health.evictionPass(report.hardBoundHit());
        if (report.hardBoundHit()) {
            log.warn("Backlog hard bound reached in {} scope(s); lagging subscribers will need to resync",
                    report.hardBoundScopes());
        }
        if (report.scopesEvicted() > 0 || report.failedScopes() > 0) {
            log.info("Backlog eviction: {} entries from {} scope(s), {} failed",
                    report.entriesEvicted(), report.scopesEvicted(), report.failedScopes());
        }
        return report;
    }
}
