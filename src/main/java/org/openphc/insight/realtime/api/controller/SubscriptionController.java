package org.openphc.insight.realtime.api.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.dto.ApiResponse;
import org.openphc.insight.realtime.api.dto.SubscriberDto;
import org.openphc.insight.realtime.api.exception.UnknownSubscriberException;
import org.openphc.insight.realtime.delivery.SessionManager;
import org.openphc.insight.realtime.domain.model.enums.DisconnectReason;
import org.openphc.insight.realtime.subscription.SubscriptionRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;

/**
 * Operator view of live subscriptions: list, force an authorization refresh, disconnect.
 */
@RestController
@RequestMapping("/v1/subscriptions")
@RequiredArgsConstructor
@Slf4j
public class SubscriptionController {

    private final SubscriptionRegistry registry;
    private final SessionManager sessionManager;

    @GetMapping
    public ResponseEntity<ApiResponse<List<SubscriberDto>>> list() {
        List<SubscriberDto> subscribers = registry.snapshot().all().stream()
                .map(SubscriberDto::from)
                .sorted(Comparator.comparing(SubscriberDto::getConnectionId))
                .toList();
        return ResponseEntity.ok(ApiResponse.success(subscribers));
    }

    @PostMapping("/{connectionId}/refresh-authorization")
    public ResponseEntity<ApiResponse<SubscriberDto>> refreshAuthorization(@PathVariable String connectionId) {
        registry.refreshAuthorization(connectionId);
        log.info("Authorization of {} refreshed by operator", connectionId);
        return ResponseEntity.ok(ApiResponse.success(SubscriberDto.from(
                registry.find(connectionId).orElseThrow(() -> new UnknownSubscriberException(connectionId)))));
    }

    @DeleteMapping("/{connectionId}")
    public ResponseEntity<Void> disconnect(@PathVariable String connectionId) {
        sessionManager.disconnect(connectionId, DisconnectReason.OPERATOR);
        log.info("Connection {} disconnected by operator", connectionId);
        return ResponseEntity.noContent().build();
    }
}
