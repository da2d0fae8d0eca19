package com.bbthechange.mobilelogin.socket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * One connected client. Sends are safe from any worker thread because the underlying
 * session is a {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}.
 */
public class SocketConnection {

    private static final Logger logger = LoggerFactory.getLogger(SocketConnection.class);

    private final String socketId;
    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public SocketConnection(String socketId, WebSocketSession session, ObjectMapper objectMapper) {
        this.socketId = socketId;
        this.session = session;
        this.objectMapper = objectMapper;
    }

    public String getSocketId() {
        return socketId;
    }

    public boolean isOpen() {
        return session.isOpen();
    }

    /**
     * Serialize and send one event. A client that has already gone away is logged and skipped.
     */
    public void send(String event, Object data) {
        if (!session.isOpen()) {
            logger.debug("Socket {} closed, dropping {}", socketId, event);
            return;
        }
        String frame;
        try {
            frame = objectMapper.writeValueAsString(new SocketEnvelope(event, objectMapper.valueToTree(data)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + event + " payload", e);
        }
        try {
            session.sendMessage(new TextMessage(frame));
        } catch (IOException e) {
            logger.warn("Failed to send {} to socket {}: {}", event, socketId, e.getMessage());
        }
    }
}
