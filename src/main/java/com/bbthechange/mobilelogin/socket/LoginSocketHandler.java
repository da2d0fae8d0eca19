package com.bbthechange.mobilelogin.socket;

import com.bbthechange.mobilelogin.dto.ConnectResponse;
import com.bbthechange.mobilelogin.model.AuditEventKind;
import com.bbthechange.mobilelogin.service.AuditService;
import com.bbthechange.mobilelogin.util.SecureTokens;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Socket endpoint. Frames are handed to {@code loginTaskExecutor} so the container thread
 * never waits on the store.
 */
@Component
public class LoginSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(LoginSocketHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_SIZE_LIMIT = 512 * 1024;

    private final Map<String, SocketConnection> connections = new ConcurrentHashMap<>();
    private final EventDispatcher dispatcher;
    private final AuditService auditService;
    private final TaskExecutor loginTaskExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LoginSocketHandler(EventDispatcher dispatcher,
                              AuditService auditService,
                              @Qualifier("loginTaskExecutor") TaskExecutor loginTaskExecutor,
                              ObjectMapper objectMapper,
                              Clock clock) {
        this.dispatcher = dispatcher;
        this.auditService = auditService;
        this.loginTaskExecutor = loginTaskExecutor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(session,
                SEND_TIME_LIMIT_MS, SEND_BUFFER_SIZE_LIMIT);
        SocketConnection connection = new SocketConnection(session.getId(), concurrent, objectMapper);
        connections.put(session.getId(), connection);
        logger.info("Socket {} connected ({} open)", session.getId(), connections.size());

        loginTaskExecutor.execute(() -> {
            auditService.record(AuditEventKind.CONNECT, connection.getSocketId(), "connect", null, "connected",
                    Map.of());
            connection.send(SocketEvents.CONNECT_RESPONSE, ConnectResponse.builder()
                    .token(SecureTokens.generateSixDigitCode())
                    .message("Welcome to the login server!")
                    .timestamp(clock.instant().toString())
                    .socketId(connection.getSocketId())
                    .status("connected")
                    .build());
        });
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        SocketConnection connection = connections.get(session.getId());
        if (connection == null) {
            logger.warn("Frame from unknown socket {}", session.getId());
            return;
        }
        String frame = message.getPayload();
        loginTaskExecutor.execute(() -> {
            try {
                dispatcher.dispatch(connection, frame);
            } catch (RuntimeException e) {
                // The error event itself could not be delivered
                logger.error("Failed to handle frame on socket {}", connection.getSocketId(), e);
            }
        });
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("Transport error on socket {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connections.remove(session.getId());
        logger.info("Socket {} disconnected: {} ({} open)", session.getId(), status, connections.size());
    }

    int openConnections() {
        return connections.size();
    }
}
