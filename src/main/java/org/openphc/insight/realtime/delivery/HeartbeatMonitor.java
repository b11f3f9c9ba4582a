package org.openphc.insight.realtime.delivery;

import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.exception.SlowConsumerException;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.domain.model.enums.DisconnectReason;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Liveness sweep over all connections: heartbeats when idle, disconnects for missing acks,
 * prolonged backpressure and unfinished handshakes.
 */
@Component
@Slf4j
public class HeartbeatMonitor {

    private final ChannelDirectory channels;
    private final SessionManager sessionManager;
    private final Clock clock;
    private final RealtimeProperties.Delivery settings;

    public HeartbeatMonitor(ChannelDirectory channels, SessionManager sessionManager,
                            Clock clock, RealtimeProperties properties) {
        this.channels = channels;
        this.sessionManager = sessionManager;
        this.clock = clock;
        this.settings = properties.getDelivery();
    }

    @Scheduled(fixedDelayString = "${insight.delivery.monitor-interval-ms:1000}")
    public void sweep() {
        Instant now = clock.instant();
        sessionManager.expireHandshakes(now);
        for (ConnectionChannel channel : channels.all()) {
            try {
                channel.checkBackpressure(now, settings.getSlowConsumerTimeout());
                if (channel.isAckOverdue(now, settings.getAckTimeout())) {
                    log.info("Connection {} sent no acknowledgement within {}",
                            channel.connectionId(), settings.getAckTimeout());
                    channel.close(DisconnectReason.ACK_TIMEOUT);
                } else if (channel.isIdle(now, settings.getHeartbeatInterval())) {
                    channel.heartbeat();
                }
            } catch (SlowConsumerException e) {
                log.warn("Disconnecting slow consumer: {}", e.getMessage());
                channel.close(DisconnectReason.SLOW_CONSUMER);
            }
        }
    }
}
