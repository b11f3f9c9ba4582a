package org.openphc.insight.realtime.api.controller;

import lombok.RequiredArgsConstructor;
import org.openphc.insight.realtime.api.dto.ApiResponse;
import org.openphc.insight.realtime.api.dto.PipelineStatusDto;
import org.openphc.insight.realtime.delivery.ChannelDirectory;
import org.openphc.insight.realtime.health.PipelineHealth;
import org.openphc.insight.realtime.routing.DeliverySequencer;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Pipeline health for operators.
 */
@RestController
@RequestMapping("/v1/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineHealth health;
    private final DeliverySequencer sequencer;
    private final ChannelDirectory channels;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<PipelineStatusDto>> health() {
        return ResponseEntity.ok(ApiResponse.success(
                PipelineStatusDto.from(health.report(), sequencer.releasedHigh(),
                        sequencer.pendingCount(), channels.size())));
    }
}
