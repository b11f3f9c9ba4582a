package org.openphc.insight.realtime.routing;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.exception.GapExceededException;
import org.openphc.insight.realtime.backlog.ReplayStore;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.delivery.ConnectionChannel;
import org.openphc.insight.realtime.delivery.ConnectionChannel.EnqueueResult;
import org.openphc.insight.realtime.domain.model.AuthorizationSnapshot;
import org.openphc.insight.realtime.domain.model.ChangeEvent;
import org.openphc.insight.realtime.domain.model.DeliveryTask;
import org.openphc.insight.realtime.domain.model.GapMarker;
import org.openphc.insight.realtime.domain.model.ScopeKey;
import org.openphc.insight.realtime.domain.model.Subscriber;
import org.openphc.insight.realtime.domain.model.enums.DisconnectReason;
import org.openphc.insight.realtime.health.PipelineHealth;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Brings a channel from its cursor up to the live boundary using the backlog.
 * <p>
 * All authorized scopes of the subscriber are read, merged by sequence and filtered through the
 * current authorization. If any scope no longer covers the range, or upstream changes inside it
 * were lost, the channel gets {@code resync_required} instead, and the replay is not retried.
 * <p>
 * Missing sequences and upstream gaps are recorded in the {@link ReplayStore}. While the store
 * refuses the write they are held here and retried on the eviction schedule.
 */
@Service
@Slf4j
public class ReplayService {

    private final ReplayStore replayStore;
    private final DeliveryTaskFactory taskFactory;
    private final PipelineHealth health;
    private final Executor replayExecutor;
    private final Duration enqueueTimeout;
    private final Map<ScopeKey, Long> pendingMissing = new ConcurrentHashMap<>();
    private final NavigableSet<GapMarker> pendingUpstreamGaps =
            new ConcurrentSkipListSet<>(Comparator.comparingLong(GapMarker::getLastSequence));
    private final Counter replays;
    private final Counter resyncs;

    public ReplayService(ReplayStore replayStore,
                         DeliveryTaskFactory taskFactory,
                         PipelineHealth health,
                         @Qualifier("replayExecutor") Executor replayExecutor,
                         RealtimeProperties properties,
                         MeterRegistry meterRegistry) {
        this.replayStore = replayStore;
        this.taskFactory = taskFactory;
        this.health = health;
        this.replayExecutor = replayExecutor;
        this.enqueueTimeout = properties.getDelivery().getReplayEnqueueTimeout();
        this.replays = Counter.builder("insight.replay.runs").tag("outcome", "complete").register(meterRegistry);
        this.resyncs = Counter.builder("insight.replay.runs").tag("outcome", "resync").register(meterRegistry);
    }

    /**
     * Records that the backlog is missing {@code sequence} for the scope, so replays covering it
     * must resync.
     */
    public void markTainted(ScopeKey scope, long sequence) {
        try {
            replayStore.markMissing(scope, sequence);
        } catch (RuntimeException e) {
            pendingMissing.merge(scope, sequence, Math::max);
            log.error("Could not record missing {} #{}, holding it until the store recovers: {}",
                    scope, sequence, e.getMessage());
        }
    }

    /**
     * Records an unrecoverable upstream gap, so replays that cross it resync instead of
     * skipping the lost changes.
     */
    public void recordUpstreamGap(GapMarker marker) {
        try {
            replayStore.recordUpstreamGap(marker.getLastSequence(), marker.getReason(), marker.getDetectedAt());
        } catch (RuntimeException e) {
            pendingUpstreamGaps.add(marker);
            log.error("Could not record upstream gap after #{}, holding it until the store recovers: {}",
                    marker.getLastSequence(), e.getMessage());
        }
    }

    /**
     * Retries the gap records the store refused earlier.
     *
     * @return records still pending
     */
    @Scheduled(fixedDelayString = "${insight.backlog.eviction-interval-ms:30000}")
    public int flushPendingGaps() {
        if (pendingMissing.isEmpty() && pendingUpstreamGaps.isEmpty()) {
            return 0;
        }
        for (Map.Entry<ScopeKey, Long> entry : pendingMissing.entrySet()) {
            try {
                replayStore.markMissing(entry.getKey(), entry.getValue());
                pendingMissing.remove(entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                log.warn("Missing {} #{} still not recorded: {}", entry.getKey(), entry.getValue(), e.getMessage());
            }
        }
        for (GapMarker marker : pendingUpstreamGaps) {
            try {
                replayStore.recordUpstreamGap(marker.getLastSequence(), marker.getReason(), marker.getDetectedAt());
                pendingUpstreamGaps.remove(marker);
            } catch (RuntimeException e) {
                log.warn("Upstream gap after #{} still not recorded: {}", marker.getLastSequence(), e.getMessage());
            }
        }
        return pendingMissing.size() + pendingUpstreamGaps.size();
    }

    public void scheduleReplay(ConnectionChannel channel, long fromExclusive, long throughInclusive) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        try {
            replayExecutor.execute(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    replay(channel, fromExclusive, throughInclusive);
                } finally {
                    MDC.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Replay executor rejected connection {}: {}", channel.connectionId(), e.getMessage());
            health.replayFailure();
            channel.finishReplay(throughInclusive, "replay unavailable");
        }
    }

    public void replay(ConnectionChannel channel, long fromExclusive, long throughInclusive) {
        if (throughInclusive <= fromExclusive) {
            channel.finishReplay(throughInclusive, null);
            return;
        }
        Subscriber subscriber = channel.getSubscriber();
        List<ChangeEvent> events;
        try {
            events = collect(subscriber, fromExclusive, throughInclusive);
        } catch (GapExceededException e) {
            resyncs.increment();
            log.info("Connection {} fell behind the backlog: {}", channel.connectionId(), e.getMessage());
            channel.finishReplay(throughInclusive, e.getScope() == null ? "upstream gap" : "backlog window exceeded");
            return;
        } catch (RuntimeException e) {
            resyncs.increment();
            health.replayFailure();
            log.error("Replay for connection {} failed: {}", channel.connectionId(), e.getMessage(), e);
            channel.finishReplay(throughInclusive, "replay unavailable");
            return;
        }

        try {
            for (ChangeEvent event : events) {
                Optional<DeliveryTask> task = taskFactory.createIfEligible(event, subscriber);
                if (task.isEmpty()) {
                    continue;
                }
                EnqueueResult result = channel.enqueueReplay(task.get(), enqueueTimeout);
                if (result == EnqueueResult.STOPPED) {
                    channel.replayStopped();
                    log.debug("Replay for {} stopped at #{}", channel.connectionId(), event.getSequence());
                    return;
                }
                if (result == EnqueueResult.TIMED_OUT) {
                    log.warn("Connection {} did not accept replay within {}", channel.connectionId(), enqueueTimeout);
                    channel.close(DisconnectReason.SLOW_CONSUMER);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.close(DisconnectReason.SHUTDOWN);
            return;
        }
        replays.increment();
        log.debug("Replayed {} event(s) to {} through #{}", events.size(), channel.connectionId(), throughInclusive);
        channel.finishReplay(throughInclusive, null);
    }

    private List<ChangeEvent> collect(Subscriber subscriber, long fromExclusive, long throughInclusive) {
        OptionalLong upstreamGap = upstreamGapWithin(fromExclusive, throughInclusive);
        if (upstreamGap.isPresent()) {
            throw GapExceededException.upstream(fromExclusive, upstreamGap.getAsLong());
        }
        AuthorizationSnapshot authorization = subscriber.getAuthorization();
        List<ChangeEvent> merged = new ArrayList<>();
        for (String patientId : authorization.authorizedPatientIds()) {
            ScopeKey scope = new ScopeKey(subscriber.getTenantId(), patientId);
            Long missing = pendingMissing.get(scope);
            if (missing != null && missing > fromExclusive) {
                throw new GapExceededException(scope, fromExclusive, missing);
            }
            for (ChangeEvent event : replayStore.replay(scope, fromExclusive)) {
                if (event.getSequence() > throughInclusive) {
                    break;
                }
                merged.add(event);
            }
        }
        merged.sort(Comparator.comparingLong(ChangeEvent::getSequence));
        return merged;
    }

    private OptionalLong upstreamGapWithin(long fromExclusive, long throughInclusive) {
        for (GapMarker marker : pendingUpstreamGaps.descendingSet()) {
            long last = marker.getLastSequence();
            if (last > fromExclusive && last <= throughInclusive) {
                return OptionalLong.of(last);
            }
        }
        return replayStore.upstreamGapWithin(fromExclusive, throughInclusive);
    }
}
