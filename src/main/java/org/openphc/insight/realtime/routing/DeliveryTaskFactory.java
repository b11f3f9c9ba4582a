package org.openphc.insight.realtime.routing;

import lombok.RequiredArgsConstructor;
import org.openphc.insight.realtime.domain.model.AuthorizationSnapshot;
import org.openphc.insight.realtime.domain.model.ChangeEvent;
import org.openphc.insight.realtime.domain.model.DeliveryTask;
import org.openphc.insight.realtime.domain.model.Subscriber;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Creates a delivery task when the subscriber's current authorization admits the event.
 * The authorization snapshot is read once, so eligibility and the view agree.
 */
@Component
@RequiredArgsConstructor
public class DeliveryTaskFactory {

    private final DeliveryViewBuilder viewBuilder;

    public Optional<DeliveryTask> createIfEligible(ChangeEvent event, Subscriber subscriber) {
        AuthorizationSnapshot authorization = subscriber.getAuthorization();
        if (!subscriber.getTenantId().equals(event.getTenantId())
                || !authorization.permits(event.getPatientId())) {
            return Optional.empty();
        }
        return Optional.of(DeliveryTask.of(event, subscriber, authorization,
                viewBuilder.build(event, authorization.entitlements())));
    }
}
