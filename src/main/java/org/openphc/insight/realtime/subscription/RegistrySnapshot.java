package org.openphc.insight.realtime.subscription;

import org.openphc.insight.realtime.domain.model.Subscriber;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry state. Each mutation of the registry produces a new snapshot with a
 * higher version.
 */
public final class RegistrySnapshot {

    private static final RegistrySnapshot EMPTY = new RegistrySnapshot(0L, Map.of());

    private final long version;
    private final Map<String, Subscriber> byConnection;
    private final Map<String, List<Subscriber>> byTenant;

    private RegistrySnapshot(long version, Map<String, Subscriber> byConnection) {
        this.version = version;
        this.byConnection = Collections.unmodifiableMap(byConnection);
        Map<String, List<Subscriber>> tenants = new HashMap<>();
        byConnection.values().forEach(s ->
                tenants.computeIfAbsent(s.getTenantId(), t -> new ArrayList<>()).add(s));
        tenants.replaceAll((t, list) -> List.copyOf(list));
        this.byTenant = Collections.unmodifiableMap(tenants);
    }

    public static RegistrySnapshot empty() {
        return EMPTY;
    }

    RegistrySnapshot with(Subscriber subscriber) {
        Map<String, Subscriber> next = new LinkedHashMap<>(byConnection);
        next.put(subscriber.getConnectionId(), subscriber);
        return new RegistrySnapshot(version + 1, next);
    }

    RegistrySnapshot without(String connectionId) {
        Map<String, Subscriber> next = new LinkedHashMap<>(byConnection);
        next.remove(connectionId);
        return new RegistrySnapshot(version + 1, next);
    }

    RegistrySnapshot bump() {
        return new RegistrySnapshot(version + 1, new LinkedHashMap<>(byConnection));
    }

    public long version() {
        return version;
    }

    public Optional<Subscriber> find(String connectionId) {
        return Optional.ofNullable(byConnection.get(connectionId));
    }

    public List<Subscriber> subscribersFor(String tenantId) {
        return byTenant.getOrDefault(tenantId, List.of());
    }

    public Collection<Subscriber> all() {
        return byConnection.values();
    }

    public int size() {
        return byConnection.size();
    }
}
