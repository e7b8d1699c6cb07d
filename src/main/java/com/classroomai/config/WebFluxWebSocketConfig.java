package com.classroomai.config;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;

import com.classroomai.handler.LessonWebSocketHandler;

/**
 * WebFlux WebSocket configuration: one channel per lesson at /ws/lesson/{lessonId}
 */
@Configuration
public class WebFluxWebSocketConfig {

    private final LessonWebSocketHandler lessonHandler;
    private final int maxFramePayloadLength;

    public WebFluxWebSocketConfig(LessonWebSocketHandler lessonHandler,
                                  ClassroomProperties properties) {
        this.lessonHandler = lessonHandler;
        this.maxFramePayloadLength = properties.getWebsocket().getMaxFrameSize();
    }

    @Bean
    public HandlerMapping webSocketHandlerMapping() {
        Map<String, WebSocketHandler> map = Map.of(LessonWebSocketHandler.PATH_PATTERN, lessonHandler);

        SimpleUrlHandlerMapping handlerMapping = new SimpleUrlHandlerMapping();
        handlerMapping.setOrder(Ordered.HIGHEST_PRECEDENCE);
        handlerMapping.setUrlMap(map);
        return handlerMapping;
    }

    @Bean
    public WebSocketHandlerAdapter handlerAdapter() {
        return new WebSocketHandlerAdapter(webSocketService());
    }

    /**
     * Commands and events are small JSON envelopes, so the frame limit stays low (64KB default)
     */
    @Bean
    public WebSocketService webSocketService() {
        ReactorNettyRequestUpgradeStrategy strategy = new ReactorNettyRequestUpgradeStrategy(
            () -> reactor.netty.http.server.WebsocketServerSpec.builder()
                .maxFramePayloadLength(maxFramePayloadLength)
        );
        return new HandshakeWebSocketService(strategy);
    }
}
