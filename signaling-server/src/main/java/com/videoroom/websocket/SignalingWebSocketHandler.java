package com.videoroom.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * 브라우저와의 WebSocket 시그널링 프레임을 받아 세션별 {@link PeerEndpoint}로 넘긴다.
 */
@Component
public class SignalingWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(SignalingWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final PeerEndpointFactory endpointFactory;

    // 세션 ID -> 엔드포인트
    private final Map<String, PeerEndpoint> endpoints = new ConcurrentHashMap<>();

    public SignalingWebSocketHandler(ObjectMapper objectMapper, PeerEndpointFactory endpointFactory) {
        this.objectMapper = objectMapper;
        this.endpointFactory = endpointFactory;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        endpoints.put(session.getId(), endpointFactory.create(new WebSocketPeerTransport(session)));
        log.debug("WebSocket connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        PeerEndpoint endpoint = endpoints.get(session.getId());
        if (endpoint == null) {
            log.debug("Message for unknown session {}", session.getId());
            return;
        }
        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException ex) {
            endpoint.sendError("unknown", "Malformed frame: " + ex.getOriginalMessage());
            return;
        }
        String action = optionalText(frame, "action");
        if (action == null || action.isBlank()) {
            endpoint.sendError("unknown", "action is required");
            return;
        }
        log.debug("Incoming action {} from session {}", action, session.getId());
        try {
            switch (action) {
                case "join" -> handleJoin(endpoint, frame);
                case "mediaEvent" -> handleMediaEvent(endpoint, frame);
                case "leave" -> endpoint.leave();
                default -> endpoint.sendError(action, "Unknown action: " + action);
            }
        } catch (IllegalArgumentException | IllegalStateException ex) {
            log.warn("Action {} failed for session {}: {}", action, session.getId(), ex.getMessage());
            endpoint.sendError(action, ex.getMessage());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
        PeerEndpoint endpoint = endpoints.remove(session.getId());
        if (endpoint != null) {
            endpoint.terminate("transport error");
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        // 연결이 끊기면 엔드포인트를 종료한다. 방에서의 정리는 코디네이터가 맡는다.
        PeerEndpoint endpoint = endpoints.remove(session.getId());
        if (endpoint != null) {
            endpoint.terminate("transport closed: " + status.getCode());
        }
        log.debug("WebSocket closed: {} ({})", session.getId(), status);
    }

    private void handleJoin(PeerEndpoint endpoint, JsonNode frame) {
        String topic = requiredText(frame, "topic");
        JoinResult result = endpoint.onJoinRequest(topic);
        if (!result.isSuccess()) {
            endpoint.sendError("join", result.getError().getReason());
        }
    }

    private void handleMediaEvent(PeerEndpoint endpoint, JsonNode frame) {
        JsonNode data = frame.get("data");
        if (data == null) {
            throw new IllegalArgumentException("data is required");
        }
        endpoint.onInboundClientEvent(data);
    }

    int endpointCount() {
        return endpoints.size();
    }

    private String requiredText(JsonNode node, String field) {
        String value = optionalText(node, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    private String optionalText(JsonNode node, String field) {
        JsonNode valueNode = node.get(field);
        if (valueNode == null || valueNode.isNull()) {
            return null;
        }
        return valueNode.asText();
    }
}
