package com.familycalendar.dispatch.ws;

import com.familycalendar.core.config.CalendarProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the live-update handler at {@code calendar.realtime.path}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final int MAX_MESSAGE_BUFFER_BYTES = 64 * 1024;

    private final LiveUpdateWebSocketHandler handler;
    private final CalendarProperties properties;

    public WebSocketConfig(LiveUpdateWebSocketHandler handler, CalendarProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, properties.getRealtime().getPath());
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        var container = new ServletServerContainerFactoryBean();
        container.setMaxBinaryMessageBufferSize(MAX_MESSAGE_BUFFER_BYTES);
        container.setMaxTextMessageBufferSize(MAX_MESSAGE_BUFFER_BYTES);
        return container;
    }
}
