package org.openphc.insight.realtime.domain.model;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicLong;

/**
 * One authenticated connection. Identity fields are fixed; the authorization snapshot is
 * swapped atomically on refresh and the cursor only moves forward.
 */
@Getter
public class Subscriber {

    private final String connectionId;
    private final String userId;
    private final String tenantId;
    private final long registeredVersion;
    private volatile AuthorizationSnapshot authorization;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicLong cursor;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicLong acknowledged = new AtomicLong();

    public Subscriber(String connectionId, String userId, String tenantId,
                      AuthorizationSnapshot authorization, long initialCursor,
                      long registeredVersion) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.tenantId = tenantId;
        this.authorization = authorization;
        this.cursor = new AtomicLong(Math.max(0L, initialCursor));
        this.registeredVersion = registeredVersion;
    }

    /** Highest sequence delivered to, or explicitly skipped by, this subscriber. */
    public long cursor() {
        return cursor.get();
    }

    public long advanceCursor(long sequence) {
        return cursor.accumulateAndGet(sequence, Math::max);
    }

    public long acknowledged() {
        return acknowledged.get();
    }

    /**
     * Records a client acknowledgement. Acks beyond the cursor are ignored.
     */
    public boolean acknowledge(long sequence) {
        if (sequence > cursor.get()) {
            return false;
        }
        acknowledged.accumulateAndGet(sequence, Math::max);
        return true;
    }

    public void replaceAuthorization(AuthorizationSnapshot snapshot) {
        this.authorization = snapshot;
    }

    public boolean isEligibleFor(ChangeEvent event) {
        return tenantId.equals(event.getTenantId()) && authorization.permits(event.getPatientId());
    }
}
