package org.vellaric.config;

import org.vellaric.socket.DeploymentStatusWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * WebSocket 配置
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final DeploymentStatusWebSocketHandler deploymentStatusWebSocketHandler;

    public WebSocketConfig(DeploymentStatusWebSocketHandler deploymentStatusWebSocketHandler) {
        this.deploymentStatusWebSocketHandler = deploymentStatusWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(deploymentStatusWebSocketHandler, "/ws/deployments")
            .setAllowedOrigins("*");
    }
}
