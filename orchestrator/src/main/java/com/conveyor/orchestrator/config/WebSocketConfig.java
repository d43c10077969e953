package com.conveyor.orchestrator.config;

import com.conveyor.orchestrator.runner.RunnerSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the runner websocket endpoint at /ws/runner.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RunnerSocketHandler runnerSocketHandler;

    public WebSocketConfig(RunnerSocketHandler runnerSocketHandler) {
        this.runnerSocketHandler = runnerSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(runnerSocketHandler, "/ws/runner")
                .setAllowedOrigins("*");
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(512 * 1024); // log batches can be large
        container.setMaxSessionIdleTimeout(120_000L);
        return container;
    }
}
