package org.openphc.insight.realtime.routing;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.backlog.ReplayStore;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.domain.model.ChangeEvent;
import org.openphc.insight.realtime.domain.model.DeliveryTask;
import org.openphc.insight.realtime.domain.model.GapMarker;
import org.openphc.insight.realtime.domain.model.ScopeKey;
import org.openphc.insight.realtime.domain.model.SequenceSkip;
import org.openphc.insight.realtime.domain.model.SourceSignal;
import org.openphc.insight.realtime.domain.model.Subscriber;
import org.openphc.insight.realtime.source.SignalSink;
import org.openphc.insight.realtime.subscription.RegistrySnapshot;
import org.openphc.insight.realtime.subscription.SubscriptionRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fans change events out to eligible subscribers.
 * <p>
 * Events are partitioned by scope over single-threaded workers, so events of one scope are
 * appended and routed in order without a global lock. Each worker appends to the backlog,
 * computes the tasks from one registry snapshot and hands the result to the
 * {@link DeliverySequencer}, which restores global order.
 */
@Component
@Slf4j
public class EventRouter implements SignalSink {

    private static final long POLL_MILLIS = 100;

    private final SubscriptionRegistry registry;
    private final ReplayStore replayStore;
    private final ReplayService replayService;
    private final DeliveryTaskFactory taskFactory;
    private final DeliverySequencer sequencer;
    private final Timer routingTimer;
    private final int workerCount;
    private final int queueCapacity;

    private volatile boolean accepting;
    private List<Partition> partitions = List.of();

    public EventRouter(SubscriptionRegistry registry,
                       ReplayStore replayStore,
                       ReplayService replayService,
                       DeliveryTaskFactory taskFactory,
                       DeliverySequencer sequencer,
                       RealtimeProperties properties,
                       MeterRegistry meterRegistry) {
        this.registry = registry;
        this.replayStore = replayStore;
        this.replayService = replayService;
        this.taskFactory = taskFactory;
        this.sequencer = sequencer;
        this.workerCount = properties.getRouter().getWorkers();
        this.queueCapacity = properties.getRouter().getPartitionQueueCapacity();
        this.routingTimer = Timer.builder("insight.router.routing.duration")
                .description("Backlog append, eligibility and view building per event")
                .register(meterRegistry);
    }

    public synchronized void start() {
        if (accepting) {
            return;
        }
        List<Partition> started = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            Partition partition = new Partition(i);
            partition.thread.start();
            started.add(partition);
        }
        partitions = List.copyOf(started);
        accepting = true;
        log.info("Event router started with {} partition(s)", workerCount);
    }

    /**
     * Blocks while the target partition is full; the source slows down rather than losing events.
     */
    @Override
    public void submit(SourceSignal signal) throws InterruptedException {
        if (!accepting) {
            throw new IllegalStateException("Event router is not running");
        }
        if (signal instanceof GapMarker marker) {
            if (!marker.isRecoverable()) {
                replayService.recordUpstreamGap(marker);
            }
            sequencer.gap(marker);
        } else if (signal instanceof SequenceSkip skip) {
            sequencer.skip(skip.getSequence());
        } else if (signal instanceof ChangeEvent event) {
            partitionFor(event.scopeKey()).queue.put(event);
        } else {
            throw new IllegalArgumentException("Unsupported signal: " + signal.getClass().getName());
        }
    }

    /**
     * Stops accepting events and waits for the partitions to route what they hold.
     */
    public void drain(Duration timeout) {
        List<Partition> current;
        synchronized (this) {
            accepting = false;
            current = partitions;
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Partition partition : current) {
            partition.running = false;
            try {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                partition.thread.join(Math.max(1, remaining));
                if (partition.thread.isAlive()) {
                    log.warn("Partition {} still has {} event(s) after drain timeout",
                            partition.index, partition.queue.size());
                    partition.thread.interrupt();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        log.info("Event router drained");
    }

    public boolean isRunning() {
        return accepting;
    }

    void route(ChangeEvent event) {
        ScopeKey scope = event.scopeKey();
        Timer.Sample sample = Timer.start();
        RegistrySnapshot snapshot = registry.snapshot();
        List<DeliveryTask> tasks = new ArrayList<>();
        try {
            try {
                replayStore.append(scope, event);
            } catch (RuntimeException e) {
                replayService.markTainted(scope, event.getSequence());
                log.error("Backlog append failed for {} #{}; replays across it will resync: {}",
                        scope, event.getSequence(), e.getMessage());
            }
            for (Subscriber subscriber : snapshot.subscribersFor(event.getTenantId())) {
                try {
                    taskFactory.createIfEligible(event, subscriber).ifPresent(tasks::add);
                } catch (RuntimeException e) {
                    log.error("Building delivery for {} #{} to {} failed: {}", scope, event.getSequence(),
                            subscriber.getConnectionId(), e.getMessage(), e);
                }
            }
        } finally {
            sequencer.complete(new RoutedEvent(event, snapshot.version(), tasks));
            sample.stop(routingTimer);
        }
    }

    private Partition partitionFor(ScopeKey scope) {
        return partitions.get(Math.floorMod(scope.hashCode(), partitions.size()));
    }

    private final class Partition {
        private final int index;
        private final BlockingQueue<ChangeEvent> queue = new ArrayBlockingQueue<>(queueCapacity);
        private final Thread thread;
        private volatile boolean running = true;

        private Partition(int index) {
            this.index = index;
            this.thread = new Thread(this::run, "router-partition-" + index);
            this.thread.setDaemon(true);
        }

        private void run() {
            while (running || !queue.isEmpty()) {
                try {
                    ChangeEvent event = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                    if (event != null) {
                        route(event);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (RuntimeException e) {
                    log.error("Partition {} failed routing an event: {}", index, e.getMessage(), e);
                }
            }
        }
    }
}
