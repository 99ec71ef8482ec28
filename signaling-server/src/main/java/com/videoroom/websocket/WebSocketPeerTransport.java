package com.videoroom.websocket;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * Spring WebSocket 세션을 {@link PeerTransport}로 감싼다. 여러 스레드에서 보내도 안전하다.
 */
public class WebSocketPeerTransport implements PeerTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketPeerTransport.class);

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;

    public WebSocketPeerTransport(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public void send(ObjectNode frame) throws IOException {
        session.sendMessage(new TextMessage(frame.toString()));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close(String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(reason == null || reason.isBlank()
                    ? CloseStatus.NORMAL
                    : CloseStatus.NORMAL.withReason(truncate(reason)));
        } catch (IOException ex) {
            log.debug("Failed to close WebSocket session {}: {}", session.getId(), ex.getMessage());
        }
    }

    // close reason은 123바이트로 제한된다.
    private static String truncate(String reason) {
        if (reason.length() <= 100) {
            return reason;
        }
        return reason.substring(0, 100);
    }
}
