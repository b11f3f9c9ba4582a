package org.openphc.insight.realtime.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.openphc.insight.realtime.domain.model.enums.FieldClassification;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed view of the {@code insight.*} configuration tree.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "insight")
public class RealtimeProperties {

    @Valid
    private Source source = new Source();
    @Valid
    private Router router = new Router();
    @Valid
    private Backlog backlog = new Backlog();
    @Valid
    private Delivery delivery = new Delivery();
    @Valid
    private Authorization authorization = new Authorization();
    @Valid
    private Crypto crypto = new Crypto();
    @Valid
    private Auth auth = new Auth();
    @Valid
    private Health health = new Health();

    @Data
    public static class Source {
        /** {@code postgres} (LISTEN/NOTIFY on the change log) or {@code kafka}. */
        @NotBlank
        private String channel = "postgres";
        @NotBlank
        private String sourceId = "primary";
        @NotBlank
        private String notifyChannel = "insight_changes";
        private String kafkaTopic = "insight.changes";
        private String kafkaGroupId = "insight-realtime";
        @NotNull
        private Duration pollTimeout = Duration.ofMillis(500);
        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(30);
        @Min(1)
        private int degradedAfterAttempts = 5;
        @Min(1)
        private int maxCatchUpEvents = 10_000;
        @Min(1)
        private int sequenceBlockSize = 1_000;
        private String defaultKeyReference = "default";
    }

    @Data
    public static class Router {
        @Min(1)
        private int workers = 4;
        @Min(1)
        private int partitionQueueCapacity = 10_000;
        @NotNull
        private Duration shutdownDrainTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Backlog {
        /** {@code jpa} (durable) or {@code memory} (single node, volatile). */
        @NotBlank
        private String store = "jpa";
        @NotNull
        private Duration retention = Duration.ofHours(24);
        @Min(1)
        private int maxEntriesPerScope = 5_000;
        @NotNull
        private Duration hardRetention = Duration.ofDays(7);
        @Min(1)
        private int hardMaxEntriesPerScope = 50_000;
        private long evictionIntervalMs = 30_000;
    }

    @Data
    public static class Delivery {
        @Min(1)
        private int queueCapacity = 1_000;
        @NotNull
        private Duration heartbeatInterval = Duration.ofSeconds(15);
        @NotNull
        private Duration ackTimeout = Duration.ofSeconds(60);
        @NotNull
        private Duration slowConsumerTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration handshakeTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration replayEnqueueTimeout = Duration.ofSeconds(5);
        private long monitorIntervalMs = 1_000;
        private boolean exclusiveSessions = false;
        private String endpoint = "/v1/stream";
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }

    @Data
    public static class Authorization {
        private long refreshIntervalMs = 60_000;
        private Set<FieldClassification> defaultEntitlements =
                new LinkedHashSet<>(Set.of(FieldClassification.METADATA));
    }

    @Data
    public static class Crypto {
        /** Key reference to Base64-encoded 256-bit AES key. */
        private Map<String, String> keys = new LinkedHashMap<>();
        /** Payload field name to classification; unlisted fields are metadata. */
        private Map<String, FieldClassification> fieldClassifications = new LinkedHashMap<>();
        /** Entity kinds whose payload must arrive encrypted. */
        private Set<String> protectedEntityKinds = new LinkedHashSet<>();
    }

    @Data
    public static class Auth {
        /** Remote JWKS endpoint; ignored when {@link #jwkSet} is set. */
        private String jwksUrl;
        /** Inline JWK set JSON. */
        private String jwkSet;
        private String issuer;
        private String audience;
        @NotBlank
        private String tenantClaim = "tenant_id";
    }

    @Data
    public static class Health {
        @Min(1)
        private int degradedEvictionPasses = 3;
        @Min(1)
        private int degradedReplayFailures = 5;
        @NotNull
        private Duration replayFailureWindow = Duration.ofMinutes(5);
    }
}
