package org.openphc.insight.realtime.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.openphc.insight.realtime.domain.model.enums.HealthStatus;
import org.openphc.insight.realtime.domain.model.enums.SourceState;
import org.openphc.insight.realtime.health.HealthReport;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineStatusDto {

    private HealthStatus status;
    private String reason;
    private SourceState source;
    private long releasedThrough;
    private int pendingRelease;
    private int connections;
    private int upstreamFailures;
    private int hardEvictionPasses;
    private int recentReplayFailures;
    private Instant checkedAt;

    public static PipelineStatusDto from(HealthReport report, long releasedThrough, int pendingRelease, int connections) {
        return PipelineStatusDto.builder()
                .status(report.status())
                .reason(report.reason())
                .source(report.sourceState())
                .releasedThrough(releasedThrough)
                .pendingRelease(pendingRelease)
                .connections(connections)
                .upstreamFailures(report.consecutiveUpstreamFailures())
                .hardEvictionPasses(report.consecutiveHardEvictionPasses())
                .recentReplayFailures(report.recentReplayFailures())
                .checkedAt(report.at())
                .build();
    }
}
