package org.vellaric.socket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.vellaric.dto.DeploymentStatusEvent;
import org.vellaric.service.DeploymentStatusListener;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 部署状态推送：每次状态变更广播给所有连接
 */
@Slf4j
@Component
public class DeploymentStatusWebSocketHandler extends TextWebSocketHandler implements DeploymentStatusListener {

    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public DeploymentStatusWebSocketHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(), session);
        log.info("部署状态订阅连接建立: sessionId={}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("部署状态订阅连接关闭: sessionId={}, status={}", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket 传输异常: sessionId={}", session.getId(), exception);
        sessions.remove(session.getId());
        safeCloseSession(session, CloseStatus.SERVER_ERROR);
    }

    @Override
    public void onStatusChange(DeploymentStatusEvent event) {
        if (sessions.isEmpty()) {
            return;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("序列化部署状态事件失败: {}", event.getId(), e);
            return;
        }
        TextMessage message = new TextMessage(payload);
        for (WebSocketSession session : sessions.values()) {
            if (!session.isOpen()) {
                sessions.remove(session.getId());
                continue;
            }
            try {
                // WebSocketSession 不支持并发发送
                synchronized (session) {
                    session.sendMessage(message);
                }
            } catch (IOException e) {
                log.warn("推送部署状态失败: sessionId={}", session.getId(), e);
                sessions.remove(session.getId());
                safeCloseSession(session, CloseStatus.SERVER_ERROR);
            }
        }
    }

    public int getSessionCount() {
        return sessions.size();
    }

    private void safeCloseSession(WebSocketSession session, CloseStatus status) {
        if (session != null && session.isOpen()) {
            try {
                session.close(status);
            } catch (IOException e) {
                log.debug("关闭WebSocket失败", e);
            }
        }
    }
}
