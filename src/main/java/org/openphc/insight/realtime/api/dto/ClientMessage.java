package org.openphc.insight.realtime.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.openphc.insight.realtime.domain.model.enums.MessageType;

/**
 * Frame received from a streaming client: {@code connect} first, then {@code ack}s.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClientMessage {

    private MessageType type;
    private String token;
    private Long lastSeenCursor;
    private Long sequence;
}
