package org.vellaric.socket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.vellaric.dto.DeploymentStatusEvent;
import org.vellaric.dto.enums.DeploymentStatus;

import java.io.IOException;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DeploymentStatusWebSocketHandlerTest {

    private DeploymentStatusWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        handler = new DeploymentStatusWebSocketHandler(objectMapper);
    }

    private static WebSocketSession session(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        return session;
    }

    private static DeploymentStatusEvent event() {
        return DeploymentStatusEvent.builder()
            .id("deploy_1_abc")
            .projectName("api")
            .branch("main")
            .status(DeploymentStatus.BUILDING)
            .timestamp(LocalDateTime.now())
            .build();
    }

    @Test
    void broadcastsStatusChangesAsJson() throws Exception {
        WebSocketSession first = session("s1");
        WebSocketSession second = session("s2");
        handler.afterConnectionEstablished(first);
        handler.afterConnectionEstablished(second);

        handler.onStatusChange(event());

        ArgumentCaptor<TextMessage> message = ArgumentCaptor.forClass(TextMessage.class);
        verify(first).sendMessage(message.capture());
        verify(second).sendMessage(any(TextMessage.class));
        assertTrue(message.getValue().getPayload().contains("\"status\":\"building\""));
        assertTrue(message.getValue().getPayload().contains("deploy_1_abc"));
    }

    @Test
    void failingSessionIsDropped() throws Exception {
        WebSocketSession broken = session("s1");
        doThrow(new IOException("broken pipe")).when(broken).sendMessage(any(TextMessage.class));
        handler.afterConnectionEstablished(broken);

        handler.onStatusChange(event());

        assertEquals(0, handler.getSessionCount());
        verify(broken).close(CloseStatus.SERVER_ERROR);
    }

    @Test
    void closedConnectionsStopReceiving() throws Exception {
        WebSocketSession session = session("s1");
        handler.afterConnectionEstablished(session);
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        handler.onStatusChange(event());

        assertEquals(0, handler.getSessionCount());
        verify(session, never()).sendMessage(any(TextMessage.class));
    }
}
