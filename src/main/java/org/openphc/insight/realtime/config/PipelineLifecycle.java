package org.openphc.insight.realtime.config;

import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.delivery.SessionManager;
import org.openphc.insight.realtime.domain.model.enums.DisconnectReason;
import org.openphc.insight.realtime.routing.DeliverySequencer;
import org.openphc.insight.realtime.routing.EventRouter;
import org.openphc.insight.realtime.source.ChangeEventSource;
import org.openphc.insight.realtime.source.SequenceAllocator;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Starts the pipeline downstream-first and stops it upstream-first: on shutdown the source
 * stops reading, the router drains what it holds, the upstream channel closes and finally all
 * client connections are closed.
 */
@Component
@Slf4j
public class PipelineLifecycle implements SmartLifecycle {

    private final SequenceAllocator allocator;
    private final DeliverySequencer sequencer;
    private final EventRouter router;
    private final ChangeEventSource source;
    private final SessionManager sessionManager;
    private final Duration drainTimeout;

    private volatile boolean running;

    public PipelineLifecycle(SequenceAllocator allocator,
                             DeliverySequencer sequencer,
                             EventRouter router,
                             ChangeEventSource source,
                             SessionManager sessionManager,
                             RealtimeProperties properties) {
        this.allocator = allocator;
        this.sequencer = sequencer;
        this.router = router;
        this.source = source;
        this.sessionManager = sessionManager;
        this.drainTimeout = properties.getRouter().getShutdownDrainTimeout();
    }

    @Override
    public void start() {
        allocator.initialize();
        sequencer.initialize(allocator.lastAssigned());
        router.start();
        source.start();
        running = true;
        log.info("Realtime pipeline started");
    }

    @Override
    public void stop() {
        log.info("Stopping realtime pipeline");
        source.stopReading(drainTimeout);
        router.drain(drainTimeout);
        source.closeChannel();
        sessionManager.closeAll(DisconnectReason.SHUTDOWN);
        running = false;
        log.info("Realtime pipeline stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** Late start, early stop: after the web server is up, before it goes down. */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1000;
    }
}
