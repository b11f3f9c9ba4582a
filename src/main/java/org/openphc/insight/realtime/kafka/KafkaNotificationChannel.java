package org.openphc.insight.realtime.kafka;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.openphc.insight.realtime.api.exception.TransientUpstreamException;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.source.CatchUp;
import org.openphc.insight.realtime.source.RawNotification;
import org.openphc.insight.realtime.source.UpstreamChannel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Change notifications from a Kafka topic. Offsets are committed only after the batch has been
 * handed to the router, so a reconnect resumes from the first unprocessed record and every gap
 * is recoverable.
 */
@Component
@ConditionalOnProperty(prefix = "insight.source", name = "channel", havingValue = "kafka")
@Slf4j
public class KafkaNotificationChannel implements UpstreamChannel {

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final ConsumerFactory<String, String> consumerFactory;
    private final String topic;
    private final String groupId;

    private Consumer<String, String> consumer;

    public KafkaNotificationChannel(ConsumerFactory<String, String> changeConsumerFactory,
                                    RealtimeProperties properties) {
        this.consumerFactory = changeConsumerFactory;
        this.topic = properties.getSource().getKafkaTopic();
        this.groupId = properties.getSource().getKafkaGroupId();
    }

    @Override
    public String name() {
        return "kafka:" + topic;
    }

    @Override
    public void connect() {
        try {
            consumer = consumerFactory.createConsumer(groupId, null);
            consumer.subscribe(List.of(topic));
            log.info("Subscribed to topic '{}' as group '{}'", topic, groupId);
        } catch (KafkaException e) {
            close();
            throw new TransientUpstreamException("Subscribing to '" + topic + "' failed", e);
        }
    }

    @Override
    public boolean isConnected() {
        return consumer != null;
    }

    @Override
    public List<RawNotification> poll(Duration timeout) {
        if (consumer == null) {
            throw new TransientUpstreamException("Not connected");
        }
        ConsumerRecords<String, String> records;
        try {
            records = consumer.poll(timeout);
        } catch (KafkaException e) {
            throw new TransientUpstreamException("Polling '" + topic + "' failed", e);
        }
        List<RawNotification> result = new ArrayList<>(records.count());
        for (ConsumerRecord<String, String> record : records) {
            result.add(new RawNotification(
                    record.topic() + "-" + record.partition() + "@" + record.offset(), record.value()));
        }
        return result;
    }

    @Override
    public void commit() {
        try {
            consumer.commitSync();
        } catch (KafkaException e) {
            throw new TransientUpstreamException("Committing offsets on '" + topic + "' failed", e);
        }
    }

    @Override
    public CatchUp fetchSince(String position, int limit) {
        return CatchUp.complete(List.of());
    }

    @Override
    public void close() {
        if (consumer != null) {
            try {
                consumer.close(CLOSE_TIMEOUT);
            } catch (KafkaException e) {
                log.debug("Closing consumer failed: {}", e.getMessage());
            }
            consumer = null;
        }
    }
}
