package org.openphc.insight.realtime.routing;

import org.openphc.insight.realtime.domain.model.ChangeEvent;
import org.openphc.insight.realtime.domain.model.DeliveryTask;

import java.util.List;

/**
 * An event with the tasks computed for it from registry snapshot {@code snapshotVersion}.
 */
public record RoutedEvent(ChangeEvent event, long snapshotVersion, List<DeliveryTask> tasks) {

    public RoutedEvent {
        tasks = List.copyOf(tasks);
    }

    public long sequence() {
        return event.getSequence();
    }
}
