package org.openphc.insight.realtime.routing;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.delivery.ChannelDirectory;
import org.openphc.insight.realtime.delivery.ConnectionChannel;
import org.openphc.insight.realtime.domain.model.DeliveryTask;
import org.openphc.insight.realtime.domain.model.GapMarker;
import org.openphc.insight.realtime.domain.model.Subscriber;
import org.openphc.insight.realtime.subscription.SubscriptionRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.LongFunction;

/**
 * Reorder buffer between the router partitions and the connection channels.
 * <p>
 * Partitions finish events out of order; the sequencer releases them strictly by sequence, so
 * each subscriber sees one ordered stream across all its scopes. Attaching and resuming happen
 * under the same lock, which fixes the boundary between replayed and live events.
 */
@Component
@Slf4j
public class DeliverySequencer {

    private final SubscriptionRegistry registry;
    private final DeliveryTaskFactory taskFactory;
    private final ChannelDirectory channels;
    private final Counter recoverableGaps;
    private final Counter unrecoverableGaps;
    private final Counter refusedTasks;

    private final TreeMap<Long, RoutedEvent> pending = new TreeMap<>();
    private final Deque<GapMarker> barriers = new ArrayDeque<>();
    private final TreeSet<Long> skipped = new TreeSet<>();
    private long releasedHigh;

    public DeliverySequencer(SubscriptionRegistry registry,
                             DeliveryTaskFactory taskFactory,
                             ChannelDirectory channels,
                             MeterRegistry meterRegistry) {
        this.registry = registry;
        this.taskFactory = taskFactory;
        this.channels = channels;
        this.recoverableGaps = Counter.builder("insight.router.gaps").tag("recoverable", "true")
                .register(meterRegistry);
        this.unrecoverableGaps = Counter.builder("insight.router.gaps").tag("recoverable", "false")
                .register(meterRegistry);
        this.refusedTasks = Counter.builder("insight.delivery.refused")
                .description("Tasks refused by backpressured channels")
                .register(meterRegistry);
    }

    /**
     * Sets the release point to the last sequence assigned before this process started.
     */
    public synchronized void initialize(long lastAssignedSequence) {
        pending.clear();
        barriers.clear();
        skipped.clear();
        releasedHigh = lastAssignedSequence;
        log.info("Delivery sequencer starts after sequence {}", releasedHigh);
    }

    public synchronized void complete(RoutedEvent routed) {
        if (routed.sequence() <= releasedHigh || pending.containsKey(routed.sequence())
                || skipped.contains(routed.sequence())) {
            log.warn("Ignoring event #{} already released or pending", routed.sequence());
            return;
        }
        pending.put(routed.sequence(), routed);
        release();
    }

    /**
     * Releases a sequence that will never be routed, so the events after it are not held back.
     */
    public synchronized void skip(long sequence) {
        if (sequence <= releasedHigh || pending.containsKey(sequence)) {
            log.warn("Ignoring skip of #{} already released or pending", sequence);
            return;
        }
        log.info("Skipping sequence #{}", sequence);
        skipped.add(sequence);
        release();
    }

    public synchronized void gap(GapMarker marker) {
        barriers.addLast(marker);
        releaseBarriers();
    }

    /**
     * Registers a new channel. The factory receives {@code liveFrom}: every event from that
     * sequence on is delivered live, everything before it must come from replay.
     */
    public synchronized Attachment attach(LongFunction<ConnectionChannel> channelFactory) {
        long liveFrom = releasedHigh + 1;
        ConnectionChannel channel = channelFactory.apply(liveFrom);
        channels.register(channel);
        return new Attachment(channel, liveFrom);
    }

    /**
     * Switches a drained, paused channel back to replay mode. Returns the range it must replay
     * before live delivery continues, or empty if the channel is no longer paused.
     */
    public synchronized Optional<ReplayRange> resume(ConnectionChannel channel) {
        long from = channel.beginResume();
        if (from < 0) {
            return Optional.empty();
        }
        log.info("Resuming connection {} from sequence {} (live after {})",
                channel.connectionId(), from, releasedHigh);
        return Optional.of(new ReplayRange(from, releasedHigh));
    }

    public synchronized long releasedHigh() {
        return releasedHigh;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    private void release() {
        while (true) {
            long next = releasedHigh + 1;
            if (skipped.remove(next)) {
                releasedHigh = next;
            } else if (!pending.isEmpty() && pending.firstKey() == next) {
                RoutedEvent routed = pending.pollFirstEntry().getValue();
                releasedHigh = next;
                dispatch(routed);
            } else {
                return;
            }
            releaseBarriers();
        }
    }

    private void dispatch(RoutedEvent routed) {
        Set<String> covered = new HashSet<>();
        for (DeliveryTask task : routed.tasks()) {
            String connectionId = task.getSubscriber().getConnectionId();
            covered.add(connectionId);
            ConnectionChannel channel = channels.get(connectionId);
            if (channel != null && channel.getSubscriber() == task.getSubscriber()) {
                offer(channel, task);
            }
        }
        for (Subscriber subscriber : registry.snapshot().subscribersFor(routed.event().getTenantId())) {
            if (subscriber.getRegisteredVersion() <= routed.snapshotVersion()
                    || covered.contains(subscriber.getConnectionId())) {
                continue;
            }
            ConnectionChannel channel = channels.get(subscriber.getConnectionId());
            if (channel == null) {
                continue;
            }
            taskFactory.createIfEligible(routed.event(), subscriber).ifPresent(task -> offer(channel, task));
        }
    }

    private void offer(ConnectionChannel channel, DeliveryTask task) {
        if (!channel.offer(task)) {
            refusedTasks.increment();
        }
    }

    private void releaseBarriers() {
        while (!barriers.isEmpty() && barriers.peekFirst().getLastSequence() <= releasedHigh) {
            GapMarker marker = barriers.pollFirst();
            if (marker.isRecoverable()) {
                recoverableGaps.increment();
                log.info("Upstream gap after #{} is recoverable; caught-up events follow", marker.getLastSequence());
                continue;
            }
            unrecoverableGaps.increment();
            String reason = marker.getReason() == null ? "upstream gap" : "upstream gap: " + marker.getReason();
            Map<String, ConnectionChannel> all = channels.snapshot();
            log.warn("Unrecoverable upstream gap after #{}, resyncing {} connection(s)",
                    marker.getLastSequence(), all.size());
            all.values().forEach(channel -> channel.resync(marker.getLastSequence(), reason));
        }
    }

    public record Attachment(ConnectionChannel channel, long liveFrom) {
    }

    /** Replay {@code (fromExclusive, throughInclusive]}. */
    public record ReplayRange(long fromExclusive, long throughInclusive) {
    }
}
