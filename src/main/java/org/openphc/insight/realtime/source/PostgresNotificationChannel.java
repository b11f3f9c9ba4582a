package org.openphc.insight.realtime.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.exception.TransientUpstreamException;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.domain.model.ChangeLogRecord;
import org.openphc.insight.realtime.domain.repository.ChangeLogRecordRepository;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * LISTEN/NOTIFY on the primary database. Triggers write each change to {@code change_log} and
 * notify with {@code {"change_id": n}}; the row is loaded here. The position is the change id,
 * so catch-up after a reconnect reads the log directly.
 */
@Component
@ConditionalOnProperty(prefix = "insight.source", name = "channel", havingValue = "postgres", matchIfMissing = true)
@Slf4j
public class PostgresNotificationChannel implements UpstreamChannel {

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-z_][a-z0-9_]*$");
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final ChangeLogRecordRepository changeLogRepository;
    private final ObjectMapper objectMapper;
    private final String notifyChannel;

    private Connection connection;
    private PGConnection pgConnection;

    public PostgresNotificationChannel(DataSource dataSource,
                                       ChangeLogRecordRepository changeLogRepository,
                                       ObjectMapper objectMapper,
                                       RealtimeProperties properties) {
        String channelName = properties.getSource().getNotifyChannel();
        if (!IDENTIFIER.matcher(channelName).matches()) {
            throw new IllegalArgumentException("Invalid NOTIFY channel name: " + channelName);
        }
        this.dataSource = dataSource;
        this.changeLogRepository = changeLogRepository;
        this.objectMapper = objectMapper;
        this.notifyChannel = channelName;
    }

    @Override
    public String name() {
        return "postgres:" + notifyChannel;
    }

    @Override
    public void connect() {
        try {
            connection = dataSource.getConnection();
            connection.setAutoCommit(true);
            try (Statement statement = connection.createStatement()) {
                statement.execute("LISTEN " + notifyChannel);
            }
            pgConnection = connection.unwrap(PGConnection.class);
            log.info("Listening on NOTIFY channel '{}'", notifyChannel);
        } catch (SQLException e) {
            close();
            throw new TransientUpstreamException("LISTEN on '" + notifyChannel + "' failed", e);
        }
    }

    @Override
    public boolean isConnected() {
        return pgConnection != null;
    }

    @Override
    public List<RawNotification> poll(Duration timeout) {
        if (pgConnection == null) {
            throw new TransientUpstreamException("Not connected");
        }
        PGNotification[] notifications;
        try {
            notifications = pgConnection.getNotifications((int) Math.max(1, timeout.toMillis()));
            if ((notifications == null || notifications.length == 0)
                    && !connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                throw new TransientUpstreamException("Listener connection is no longer valid");
            }
        } catch (SQLException e) {
            throw new TransientUpstreamException("Reading notifications failed", e);
        }
        if (notifications == null || notifications.length == 0) {
            return List.of();
        }
        List<RawNotification> result = new ArrayList<>(notifications.length);
        for (PGNotification notification : notifications) {
            result.add(resolve(notification.getParameter()));
        }
        return result;
    }

    @Override
    public CatchUp fetchSince(String position, int limit) {
        Long after = parsePosition(position);
        if (after == null) {
            return CatchUp.complete(List.of());
        }
        List<ChangeLogRecord> rows;
        try {
            rows = changeLogRepository.findByIdGreaterThanOrderByIdAsc(after, PageRequest.of(0, limit + 1));
        } catch (DataAccessException e) {
            throw new TransientUpstreamException("Change log catch-up failed", e);
        }
        if (rows.size() > limit) {
            return CatchUp.incomplete("more than " + limit + " changes missed since " + after);
        }
        return CatchUp.complete(rows.stream().map(this::toRaw).toList());
    }

    @Override
    public void close() {
        pgConnection = null;
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                log.debug("Closing listener connection failed: {}", e.getMessage());
            }
            connection = null;
        }
    }

    /**
     * Loads the change row named by the notification. A payload without {@code change_id} is
     * passed through as the notification itself.
     */
    private RawNotification resolve(String parameter) {
        Long changeId = changeIdOf(parameter);
        if (changeId == null) {
            return new RawNotification(null, parameter);
        }
        Optional<ChangeLogRecord> row;
        try {
            row = changeLogRepository.findById(changeId);
        } catch (DataAccessException e) {
            throw new TransientUpstreamException("Loading change " + changeId + " failed", e);
        }
        if (row.isEmpty()) {
            log.warn("Notification for change {} has no change_log row", changeId);
            return new RawNotification(String.valueOf(changeId), null);
        }
        return toRaw(row.get());
    }

    private Long changeIdOf(String parameter) {
        if (parameter == null || parameter.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(parameter).get("change_id");
            return node != null && node.canConvertToLong() ? node.asLong() : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private RawNotification toRaw(ChangeLogRecord record) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("change_id", String.valueOf(record.getId()));
        body.put("entity_kind", record.getEntityKind());
        body.put("entity_id", record.getEntityId());
        body.put("tenant_id", record.getTenantId());
        body.put("patient_id", record.getPatientId());
        body.put("occurred_at", record.getOccurredAt() == null ? null : record.getOccurredAt().toString());
        body.put("payload", record.getPayload());
        body.put("payload_is_encrypted", record.isPayloadEncrypted());
        body.put("key_reference", record.getKeyReference());
        try {
            return new RawNotification(String.valueOf(record.getId()), objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            log.warn("Change {} could not be serialized: {}", record.getId(), e.getMessage());
            return new RawNotification(String.valueOf(record.getId()), null);
        }
    }

    private static Long parsePosition(String position) {
        if (position == null || position.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(position);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric change log position '{}'", position);
            return null;
        }
    }
}
