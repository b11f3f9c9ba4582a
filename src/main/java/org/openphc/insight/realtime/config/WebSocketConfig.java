package org.openphc.insight.realtime.config;

import lombok.RequiredArgsConstructor;
import org.openphc.insight.realtime.delivery.RealtimeWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the client stream endpoint.
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final RealtimeWebSocketHandler handler;
    private final RealtimeProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        RealtimeProperties.Delivery delivery = properties.getDelivery();
        registry.addHandler(handler, delivery.getEndpoint())
                .setAllowedOriginPatterns(delivery.getAllowedOrigins().toArray(String[]::new));
    }
}
