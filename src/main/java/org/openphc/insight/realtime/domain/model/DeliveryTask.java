package org.openphc.insight.realtime.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A routed event bound to one eligible subscriber together with its view.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DeliveryTask {

    ChangeEvent event;
    Subscriber subscriber;
    DecryptedView view;

    public static DeliveryTask of(ChangeEvent event, Subscriber subscriber,
                                  AuthorizationSnapshot authorization, DecryptedView view) {
        if (!subscriber.getTenantId().equals(event.getTenantId())
                || !authorization.permits(event.getPatientId())) {
            throw new IllegalStateException("Subscriber " + subscriber.getConnectionId()
                    + " is not eligible for scope " + event.scopeKey());
        }
        return new DeliveryTask(event, subscriber, view);
    }

    public long sequence() {
        return event.getSequence();
    }
}
