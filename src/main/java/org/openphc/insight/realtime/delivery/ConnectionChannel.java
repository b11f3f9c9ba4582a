package org.openphc.insight.realtime.delivery;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.dto.ServerMessage;
import org.openphc.insight.realtime.api.exception.SlowConsumerException;
import org.openphc.insight.realtime.domain.model.DeliveryTask;
import org.openphc.insight.realtime.domain.model.Subscriber;
import org.openphc.insight.realtime.domain.model.enums.DisconnectReason;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outbound path of one connection.
 * <p>
 * Events are queued in strictly increasing sequence order; anything at or below the last
 * queued sequence is a duplicate and dropped. The queue holds at most {@code capacity} events
 * (control frames are not counted). A drain job on the shared delivery executor sends frames
 * one at a time and advances the subscriber's cursor after each successful send.
 * <p>
 * Modes:
 * <ul>
 *   <li>REPLAYING: the replay thread fills the queue from the backlog; live tasks are held
 *   aside and merged in by {@link #finishReplay}.</li>
 *   <li>LIVE: live tasks go straight to the queue.</li>
 *   <li>PAUSED: the queue overflowed; live tasks are refused. Once the queue drains and no
 *   replay is running, the listener resumes the channel from the backlog.</li>
 *   <li>CLOSED: terminal.</li>
 * </ul>
 */
@Slf4j
public class ConnectionChannel {

    public enum EnqueueResult { ENQUEUED, SKIPPED, STOPPED, TIMED_OUT }

    enum Mode { REPLAYING, LIVE, PAUSED, CLOSED }

    private record Outbound(ServerMessage message, boolean event, long cursorAfter) {
    }

    @Getter
    private final Subscriber subscriber;
    private final ClientConnection connection;
    private final Executor deliveryExecutor;
    private final ChannelListener listener;
    private final Clock clock;
    private final int capacity;

    private final Queue<Outbound> queue = new ConcurrentLinkedQueue<>();
    private final Semaphore slots;
    private final AtomicBoolean draining = new AtomicBoolean();

    private final Deque<DeliveryTask> held = new ArrayDeque<>();
    private Mode mode = Mode.REPLAYING;
    private long lastEnqueued;
    private boolean resumeRequested;
    private boolean replayInFlight = true;
    private Instant pausedSince;
    private long pendingResyncThrough = -1;
    private String pendingResyncReason;

    private volatile boolean closed;
    private volatile Instant lastSendAt;
    private volatile Instant lastClientActivityAt;

    /**
     * Starts in REPLAYING mode with {@code startCursor} as the last sequence the client has.
     */
    public ConnectionChannel(Subscriber subscriber, ClientConnection connection, long startCursor,
                             int capacity, Executor deliveryExecutor, ChannelListener listener, Clock clock) {
        this.subscriber = subscriber;
        this.connection = connection;
        this.lastEnqueued = startCursor;
        this.capacity = capacity;
        this.slots = new Semaphore(capacity);
        this.deliveryExecutor = deliveryExecutor;
        this.listener = listener;
        this.clock = clock;
        Instant now = clock.instant();
        this.lastSendAt = now;
        this.lastClientActivityAt = now;
    }

    public String connectionId() {
        return subscriber.getConnectionId();
    }

    /**
     * Live hand-off from the sequencer. Never blocks.
     *
     * @return false when the task was refused (paused or closed)
     */
    public synchronized boolean offer(DeliveryTask task) {
        switch (mode) {
            case CLOSED:
            case PAUSED:
                return false;
            case REPLAYING:
                if (held.size() >= capacity) {
                    pause("hold buffer full during replay");
                    return false;
                }
                held.addLast(task);
                return true;
            default:
                if (task.sequence() <= lastEnqueued) {
                    return true;
                }
                if (!slots.tryAcquire()) {
                    pause("queue full");
                    return false;
                }
                queue.add(new Outbound(ServerMessage.event(task), true, task.sequence()));
                lastEnqueued = task.sequence();
                scheduleDrain();
                return true;
        }
    }

    /**
     * Replay hand-off. Waits up to {@code timeout} for queue space.
     */
    public EnqueueResult enqueueReplay(DeliveryTask task, Duration timeout) throws InterruptedException {
        synchronized (this) {
            if (mode != Mode.REPLAYING) {
                return EnqueueResult.STOPPED;
            }
            if (task.sequence() <= lastEnqueued) {
                return EnqueueResult.SKIPPED;
            }
        }
        if (!slots.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return EnqueueResult.TIMED_OUT;
        }
        synchronized (this) {
            if (mode != Mode.REPLAYING) {
                slots.release();
                return EnqueueResult.STOPPED;
            }
            queue.add(new Outbound(ServerMessage.event(task), true, task.sequence()));
            lastEnqueued = task.sequence();
            scheduleDrain();
            return EnqueueResult.ENQUEUED;
        }
    }

    /**
     * Ends a replay covering everything through {@code throughInclusive} and switches to live.
     * With a {@code resyncReason} the client is told to resync instead of {@code replay_complete}.
     */
    public synchronized void finishReplay(long throughInclusive, String resyncReason) {
        replayInFlight = false;
        if (mode != Mode.REPLAYING) {
            scheduleDrain();
            return;
        }
        if (resyncReason != null) {
            enqueueControl(ServerMessage.resyncRequired(throughInclusive, resyncReason), throughInclusive);
        } else {
            enqueueControl(ServerMessage.replayComplete(throughInclusive), throughInclusive);
        }
        lastEnqueued = Math.max(lastEnqueued, throughInclusive);
        if (pendingResyncThrough >= 0) {
            enqueueControl(ServerMessage.resyncRequired(pendingResyncThrough, pendingResyncReason),
                    pendingResyncThrough);
            lastEnqueued = Math.max(lastEnqueued, pendingResyncThrough);
            pendingResyncThrough = -1;
            pendingResyncReason = null;
        }
        mode = Mode.LIVE;
        while (!held.isEmpty()) {
            DeliveryTask task = held.pollFirst();
            if (task.sequence() <= lastEnqueued) {
                continue;
            }
            if (!slots.tryAcquire()) {
                pause("queue full after replay");
                break;
            }
            queue.add(new Outbound(ServerMessage.event(task), true, task.sequence()));
            lastEnqueued = task.sequence();
        }
        scheduleDrain();
    }

    /**
     * The replay thread gave up early because the channel left REPLAYING mode.
     */
    public synchronized void replayStopped() {
        replayInFlight = false;
        scheduleDrain();
    }

    /**
     * Tells the client to resync and skips everything through {@code skipThrough}.
     */
    public synchronized void resync(long skipThrough, String reason) {
        if (mode == Mode.CLOSED) {
            return;
        }
        if (mode == Mode.REPLAYING) {
            pendingResyncThrough = Math.max(pendingResyncThrough, skipThrough);
            pendingResyncReason = reason;
            return;
        }
        enqueueControl(ServerMessage.resyncRequired(skipThrough, reason), skipThrough);
        lastEnqueued = Math.max(lastEnqueued, skipThrough);
    }

    /**
     * Called by the sequencer under its lock when resuming a drained, paused channel.
     *
     * @return the sequence to replay from, or -1 if the channel is not paused
     */
    public synchronized long beginResume() {
        if (mode != Mode.PAUSED) {
            return -1;
        }
        mode = Mode.REPLAYING;
        replayInFlight = true;
        resumeRequested = false;
        pausedSince = null;
        held.clear();
        return lastEnqueued;
    }

    public synchronized void heartbeat() {
        if (mode == Mode.CLOSED) {
            return;
        }
        enqueueControl(ServerMessage.heartbeat(subscriber.cursor()), 0L);
    }

    public void acknowledge(long sequence) {
        lastClientActivityAt = clock.instant();
        if (!subscriber.acknowledge(sequence)) {
            log.debug("Ignoring ack #{} beyond cursor #{} on {}", sequence, subscriber.cursor(), connectionId());
        }
    }

    public void touch() {
        lastClientActivityAt = clock.instant();
    }

    /**
     * @throws SlowConsumerException when the channel has stayed paused longer than {@code timeout}
     */
    public synchronized void checkBackpressure(Instant now, Duration timeout) {
        if (mode == Mode.PAUSED && pausedSince != null && pausedSince.plus(timeout).isBefore(now)) {
            throw new SlowConsumerException(connectionId(), Duration.between(pausedSince, now).toMillis());
        }
    }

    public boolean isAckOverdue(Instant now, Duration ackTimeout) {
        return lastClientActivityAt.plus(ackTimeout).isBefore(now);
    }

    public boolean isIdle(Instant now, Duration interval) {
        return queue.isEmpty() && lastSendAt.plus(interval).isBefore(now);
    }

    /**
     * Closes the channel and the transport. Queued and held work is dropped.
     *
     * @return false if it was already closed
     */
    public boolean close(DisconnectReason reason) {
        synchronized (this) {
            if (mode == Mode.CLOSED) {
                return false;
            }
            mode = Mode.CLOSED;
            closed = true;
            held.clear();
            queue.clear();
        }
        connection.close(reason);
        listener.onClosed(this, reason);
        return true;
    }

    public synchronized long lastEnqueuedSequence() {
        return lastEnqueued;
    }

    synchronized Mode mode() {
        return mode;
    }

    public boolean isClosed() {
        return closed;
    }

    public int queuedEvents() {
        return capacity - slots.availablePermits();
    }

    private void pause(String why) {
        mode = Mode.PAUSED;
        pausedSince = clock.instant();
        held.clear();
        log.warn("Pausing connection {} at #{}: {}", connectionId(), lastEnqueued, why);
        scheduleDrain();
    }

    private void enqueueControl(ServerMessage message, long cursorAfter) {
        queue.add(new Outbound(message, false, cursorAfter));
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (closed || !draining.compareAndSet(false, true)) {
            return;
        }
        try {
            deliveryExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.error("Delivery executor rejected drain for {}: {}", connectionId(), e.getMessage());
        }
    }

    private void drain() {
        try {
            Outbound item;
            while (!closed && (item = queue.poll()) != null) {
                try {
                    connection.send(item.message());
                } catch (IOException e) {
                    log.info("Send to {} failed: {}", connectionId(), e.getMessage());
                    close(DisconnectReason.TRANSPORT_ERROR);
                    return;
                } finally {
                    if (item.event()) {
                        slots.release();
                    }
                }
                lastSendAt = clock.instant();
                if (item.cursorAfter() > 0) {
                    subscriber.advanceCursor(item.cursorAfter());
                }
                listener.onSent(this, item.message());
            }
        } finally {
            draining.set(false);
        }
        if (closed) {
            return;
        }
        if (!queue.isEmpty()) {
            scheduleDrain();
        } else if (claimResume()) {
            listener.onDrainedWhilePaused(this);
        }
    }

    private synchronized boolean claimResume() {
        if (mode != Mode.PAUSED || resumeRequested || replayInFlight || !queue.isEmpty()) {
            return false;
        }
        resumeRequested = true;
        return true;
    }
}
