package com.opsagent.config;

import com.opsagent.dispatch.WorkerWebSocketHandler;
import com.opsagent.stream.IncidentStreamWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final WorkerWebSocketHandler workerWebSocketHandler;
    private final IncidentStreamWebSocketHandler streamWebSocketHandler;
    private final DispatchProperties properties;

    public WebSocketConfig(WorkerWebSocketHandler workerWebSocketHandler,
                           IncidentStreamWebSocketHandler streamWebSocketHandler,
                           DispatchProperties properties) {
        this.workerWebSocketHandler = workerWebSocketHandler;
        this.streamWebSocketHandler = streamWebSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(workerWebSocketHandler, properties.getEndpointPath())
                .setAllowedOrigins("*");
        registry.addHandler(streamWebSocketHandler, "/ws/incidents")
                .setAllowedOrigins("*");
    }

    /**
     * Worker reports carry the whole progress log, so frames can be far larger than the
     * container default.
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        int maxBytes = (int) Math.min(Integer.MAX_VALUE, properties.getMaxMessageSize().toBytes());
        container.setMaxTextMessageBufferSize(maxBytes);
        return container;
    }
}
