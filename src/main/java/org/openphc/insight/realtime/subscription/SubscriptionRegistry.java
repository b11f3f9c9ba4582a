package org.openphc.insight.realtime.subscription;

import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.exception.UnknownSubscriberException;
import org.openphc.insight.realtime.domain.model.AuthorizationSnapshot;
import org.openphc.insight.realtime.domain.model.ScopeKey;
import org.openphc.insight.realtime.domain.model.Subscriber;
import org.openphc.insight.realtime.domain.model.enums.FieldClassification;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Live subscribers, published as copy-on-write {@link RegistrySnapshot}s. Readers take one
 * snapshot and work from it; writers serialize on a private lock.
 */
@Component
@Slf4j
public class SubscriptionRegistry {

    private final AuthorizationSource authorizationSource;
    private final Clock clock;
    private final Object writeLock = new Object();
    private volatile RegistrySnapshot current = RegistrySnapshot.empty();

    public SubscriptionRegistry(AuthorizationSource authorizationSource, Clock clock) {
        this.authorizationSource = authorizationSource;
        this.clock = clock;
    }

    public Subscriber register(String connectionId, String userId, String tenantId,
                               Set<String> authorizedPatientIds, Set<FieldClassification> entitlements) {
        return register(connectionId, userId, tenantId, authorizedPatientIds, entitlements, 0L);
    }

    public Subscriber register(String connectionId, String userId, String tenantId,
                               Set<String> authorizedPatientIds, Set<FieldClassification> entitlements,
                               long initialCursor) {
        AuthorizationSnapshot authorization =
                new AuthorizationSnapshot(authorizedPatientIds, entitlements, clock.instant());
        synchronized (writeLock) {
            if (current.find(connectionId).isPresent()) {
                throw new IllegalStateException("Connection already registered: " + connectionId);
            }
            Subscriber subscriber = new Subscriber(connectionId, userId, tenantId, authorization,
                    initialCursor, current.version() + 1);
            current = current.with(subscriber);
            log.info("Registered subscriber {} (user={}, tenant={}, patients={}, version={})",
                    connectionId, userId, tenantId, authorizedPatientIds.size(), current.version());
            return subscriber;
        }
    }

    public Optional<Subscriber> deregister(String connectionId) {
        synchronized (writeLock) {
            Optional<Subscriber> existing = current.find(connectionId);
            if (existing.isPresent()) {
                current = current.without(connectionId);
                log.info("Deregistered subscriber {} (version={})", connectionId, current.version());
            }
            return existing;
        }
    }

    /**
     * Reloads the subscriber's patient set and entitlements and swaps them in atomically.
     * On failure the previous snapshot stays in force and the exception propagates.
     */
    public AuthorizationSnapshot refreshAuthorization(String connectionId) {
        Subscriber subscriber = find(connectionId)
                .orElseThrow(() -> new UnknownSubscriberException(connectionId));
        Set<String> patients = authorizationSource.authorizedPatients(subscriber.getUserId(), subscriber.getTenantId());
        Set<FieldClassification> entitlements = authorizationSource.entitlements(subscriber.getUserId());
        AuthorizationSnapshot refreshed = new AuthorizationSnapshot(patients, entitlements, clock.instant());
        synchronized (writeLock) {
            if (current.find(connectionId).isEmpty()) {
                throw new UnknownSubscriberException(connectionId);
            }
            subscriber.replaceAuthorization(refreshed);
            current = current.bump();
        }
        log.debug("Refreshed authorization of {}: {} patient(s)", connectionId, patients.size());
        return refreshed;
    }

    public Optional<Subscriber> find(String connectionId) {
        return current.find(connectionId);
    }

    public RegistrySnapshot snapshot() {
        return current;
    }

    public List<Subscriber> subscribersOfUser(String userId) {
        return current.all().stream()
                .filter(s -> s.getUserId().equals(userId))
                .toList();
    }

    /**
     * Lowest cursor among connected subscribers authorized for each scope.
     */
    public Map<ScopeKey, Long> minCursorByScope() {
        Map<ScopeKey, Long> result = new HashMap<>();
        for (Subscriber s : current.all()) {
            long cursor = s.cursor();
            for (String patientId : s.getAuthorization().authorizedPatientIds()) {
                result.merge(new ScopeKey(s.getTenantId(), patientId), cursor, Math::min);
            }
        }
        return result;
    }
}
