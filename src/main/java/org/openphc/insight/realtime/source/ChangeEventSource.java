package org.openphc.insight.realtime.source;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.exception.MalformedEventException;
import org.openphc.insight.realtime.api.exception.TransientUpstreamException;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.domain.model.ChangeEvent;
import org.openphc.insight.realtime.domain.model.GapMarker;
import org.openphc.insight.realtime.domain.model.SequenceSkip;
import org.openphc.insight.realtime.domain.model.enums.SourceState;
import org.openphc.insight.realtime.health.PipelineHealth;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Owns the upstream subscription on a single worker thread. Each valid notification gets the
 * next global sequence and is handed to the sink in arrival order. After a reconnect a
 * {@link GapMarker} is emitted first, followed by whatever the channel can recover.
 * <p>
 * Any failure inside the loop, upstream or local, closes the channel and goes through the same
 * backoff. A sequence assigned to an event that never reached the sink is released with a
 * {@link SequenceSkip} before the next gap marker.
 */
@Component
@Slf4j
public class ChangeEventSource {

    private final UpstreamChannel channel;
    private final NotificationParser parser;
    private final NotificationDeduplicator deduplicator;
    private final SequenceAllocator allocator;
    private final SignalSink sink;
    private final PipelineHealth health;
    private final BackOff backOff;
    private final Clock clock;
    private final Duration pollTimeout;
    private final int maxCatchUpEvents;

    private final Counter accepted;
    private final Counter malformed;
    private final Counter duplicates;
    private final Counter reconnects;

    private volatile boolean running;
    private volatile SourceState state = SourceState.STOPPED;
    private Thread worker;
    private String lastPosition;
    private long unhandedSequence;

    public ChangeEventSource(UpstreamChannel channel,
                             NotificationParser parser,
                             NotificationDeduplicator deduplicator,
                             SequenceAllocator allocator,
                             SignalSink sink,
                             PipelineHealth health,
                             BackOff upstreamBackOff,
                             Clock clock,
                             RealtimeProperties properties,
                             MeterRegistry meterRegistry) {
        this.channel = channel;
        this.parser = parser;
        this.deduplicator = deduplicator;
        this.allocator = allocator;
        this.sink = sink;
        this.health = health;
        this.backOff = upstreamBackOff;
        this.clock = clock;
        this.pollTimeout = properties.getSource().getPollTimeout();
        this.maxCatchUpEvents = properties.getSource().getMaxCatchUpEvents();
        this.accepted = notificationCounter(meterRegistry, "accepted");
        this.malformed = notificationCounter(meterRegistry, "malformed");
        this.duplicates = notificationCounter(meterRegistry, "duplicate");
        this.reconnects = Counter.builder("insight.source.reconnects").register(meterRegistry);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        lastPosition = allocator.lastPosition();
        transition(SourceState.RECONNECTING);
        worker = new Thread(this::runLoop, "change-source-" + channel.name());
        worker.setDaemon(true);
        worker.start();
        log.info("Change event source started on channel '{}'", channel.name());
    }

    /**
     * Stops reading upstream and waits for the worker to hand off what it already read.
     */
    public void stopReading(Duration timeout) {
        Thread current;
        synchronized (this) {
            running = false;
            current = worker;
        }
        if (current == null) {
            return;
        }
        try {
            current.join(timeout.toMillis());
            if (current.isAlive()) {
                log.warn("Change source worker did not stop within {}, interrupting", timeout);
                current.interrupt();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public void closeChannel() {
        channel.close();
        transition(SourceState.STOPPED);
        log.info("Change event source stopped");
    }

    public SourceState state() {
        return state;
    }

    void runLoop() {
        BackOffExecution backOffExecution = null;
        boolean everConnected = false;
        while (running) {
            try {
                if (!channel.isConnected()) {
                    channel.connect();
                    recover(everConnected);
                    everConnected = true;
                    backOffExecution = null;
                    transition(SourceState.CONNECTED);
                }
                List<RawNotification> batch = channel.poll(pollTimeout);
                for (RawNotification raw : batch) {
                    process(raw);
                }
                if (!batch.isEmpty()) {
                    channel.commit();
                    allocator.recordPosition(lastPosition);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                if (!running) {
                    break;
                }
                if (backOffExecution == null) {
                    backOffExecution = backOff.start();
                }
                long waitMs = Math.max(0L, backOffExecution.nextBackOff());
                reconnects.increment();
                transition(SourceState.RECONNECTING);
                health.upstreamFailure();
                if (e instanceof TransientUpstreamException) {
                    log.warn("Upstream channel '{}' failed ({}), reconnecting in {} ms",
                            channel.name(), e.getMessage(), waitMs);
                } else {
                    log.error("Change source failed on channel '{}', reconnecting in {} ms: {}",
                            channel.name(), waitMs, e.getMessage(), e);
                }
                closeQuietly();
                if (!pause(waitMs)) {
                    break;
                }
            }
        }
        log.debug("Change source worker exiting");
    }

    /**
     * Replays what the channel can recover since the last handed-off position. On a reconnect
     * the gap marker goes first so the router sees the boundary before the caught-up events.
     */
    private void recover(boolean reconnect) throws InterruptedException {
        if (unhandedSequence > 0) {
            sink.submit(new SequenceSkip(unhandedSequence, "hand-off failed"));
            log.warn("Released sequence {} that was never handed off", unhandedSequence);
            unhandedSequence = 0;
        }
        CatchUp catchUp = channel.fetchSince(lastPosition, maxCatchUpEvents);
        if (reconnect) {
            GapMarker marker = GapMarker.builder()
                    .lastSequence(allocator.lastAssigned())
                    .upstreamPosition(lastPosition)
                    .recoverable(catchUp.recoverable())
                    .reason(catchUp.reason())
                    .detectedAt(OffsetDateTime.now(clock))
                    .build();
            log.info("Upstream reconnected after sequence {} (recoverable={}, catch-up={})",
                    marker.getLastSequence(), marker.isRecoverable(), catchUp.notifications().size());
            sink.submit(marker);
        } else if (!catchUp.recoverable()) {
            log.warn("Startup catch-up incomplete: {}", catchUp.reason());
        }
        for (RawNotification raw : catchUp.notifications()) {
            process(raw);
        }
        allocator.recordPosition(lastPosition);
    }

    private void process(RawNotification raw) throws InterruptedException {
        try {
            ParsedNotification notification = parser.parse(raw);
            String changeId = notification.getChangeId();
            if (deduplicator.isDuplicate(allocator.sourceId(), changeId)) {
                duplicates.increment();
            } else {
                ChangeEvent event = notification.toChangeEvent(allocator.next());
                unhandedSequence = event.getSequence();
                sink.submit(event);
                unhandedSequence = 0;
                deduplicator.markAsProcessed(allocator.sourceId(), changeId);
                accepted.increment();
            }
        } catch (MalformedEventException e) {
            malformed.increment();
            log.warn("Dropping malformed notification at position {}: {} (field={})",
                    raw.position(), e.getMessage(), e.getField());
        }
        if (raw.position() != null) {
            lastPosition = raw.position();
        }
    }

    private void closeQuietly() {
        try {
            channel.close();
        } catch (RuntimeException e) {
            log.warn("Closing upstream channel '{}' failed: {}", channel.name(), e.getMessage());
        }
    }

    private boolean pause(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void transition(SourceState next) {
        if (state != next) {
            log.info("Change source state {} -> {}", state, next);
            state = next;
        }
        health.sourceState(next);
    }

    private static Counter notificationCounter(MeterRegistry registry, String status) {
        return Counter.builder("insight.source.notifications")
                .tag("status", status)
                .register(registry);
    }
}
