package org.openphc.insight.realtime.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.openphc.insight.realtime.domain.model.ChangeEvent;
import org.openphc.insight.realtime.domain.model.DeliveryTask;
import org.openphc.insight.realtime.domain.model.enums.MessageType;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Set;

/**
 * Frame sent to a streaming client. Only the fields relevant to {@link #type} are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ServerMessage {

    private MessageType type;
    private Long sequence;
    private String entityKind;
    private String entityId;
    private OffsetDateTime occurredAt;
    private Map<String, String> view;
    private Set<String> withheld;
    private String reason;

    public static ServerMessage event(DeliveryTask task) {
        ChangeEvent event = task.getEvent();
        return ServerMessage.builder()
                .type(MessageType.EVENT)
                .sequence(event.getSequence())
                .entityKind(event.getEntityKind())
                .entityId(event.getEntityId())
                .occurredAt(event.getOccurredAt())
                .view(task.getView().fields())
                .withheld(task.getView().withheld().isEmpty() ? null : task.getView().withheld())
                .build();
    }

    public static ServerMessage resyncRequired(long sequence, String reason) {
        return ServerMessage.builder()
                .type(MessageType.RESYNC_REQUIRED)
                .sequence(sequence)
                .reason(reason)
                .build();
    }

    public static ServerMessage replayComplete(long sequence) {
        return ServerMessage.builder()
                .type(MessageType.REPLAY_COMPLETE)
                .sequence(sequence)
                .build();
    }

    public static ServerMessage heartbeat(long cursor) {
        return ServerMessage.builder()
                .type(MessageType.HEARTBEAT)
                .sequence(cursor)
                .build();
    }

    public static ServerMessage error(String reason) {
        return ServerMessage.builder()
                .type(MessageType.ERROR)
                .reason(reason)
                .build();
    }
}
