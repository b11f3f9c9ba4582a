package org.openphc.insight.realtime.subscription;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.exception.AuthorizationStaleException;
import org.openphc.insight.realtime.api.exception.UnknownSubscriberException;
import org.openphc.insight.realtime.domain.model.Subscriber;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically reloads every live subscriber's authorization. A failed refresh keeps the
 * last-known snapshot and is retried on the next pass.
 */
@Component
@Slf4j
public class AuthorizationRefresher {

    private final SubscriptionRegistry registry;
    private final Counter staleCounter;

    public AuthorizationRefresher(SubscriptionRegistry registry, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.staleCounter = Counter.builder("insight.authorization.refresh.failures")
                .description("Authorization refreshes that kept a stale snapshot")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${insight.authorization.refresh-interval-ms:60000}",
            initialDelayString = "${insight.authorization.refresh-interval-ms:60000}")
    public void refreshAll() {
        int refreshed = 0;
        int stale = 0;
        for (Subscriber subscriber : registry.snapshot().all()) {
            try {
                registry.refreshAuthorization(subscriber.getConnectionId());
                refreshed++;
            } catch (AuthorizationStaleException e) {
                stale++;
                staleCounter.increment();
                log.warn("Keeping stale authorization for {}: {}", subscriber.getConnectionId(), e.getMessage());
            } catch (UnknownSubscriberException e) {
                log.debug("Subscriber {} left during refresh", subscriber.getConnectionId());
            }
        }
        if (refreshed + stale > 0) {
            log.debug("Authorization refresh pass: refreshed={}, stale={}", refreshed, stale);
        }
    }
}
