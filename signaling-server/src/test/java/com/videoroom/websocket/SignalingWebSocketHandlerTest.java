package com.videoroom.websocket;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.videoroom.config.SignalingProperties;
import com.videoroom.model.RoomId;
import com.videoroom.service.RoomRegistry;
import com.videoroom.service.RoomTargetParser;
import com.videoroom.support.Await;
import com.videoroom.support.FakeMediaEngineFactory;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class SignalingWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final FakeMediaEngineFactory engineFactory = new FakeMediaEngineFactory();
    private final List<JsonNode> sent = new CopyOnWriteArrayList<>();

    private RoomRegistry registry;
    private SignalingWebSocketHandler handler;
    private WebSocketSession session;

    @BeforeEach
    void setUp() throws Exception {
        SignalingProperties properties = new SignalingProperties();
        registry = new RoomRegistry(engineFactory, executor, scheduler, properties);
        PeerEndpointFactory endpointFactory = new PeerEndpointFactory(registry, new RoomTargetParser(properties),
                objectMapper, executor, properties);
        handler = new SignalingWebSocketHandler(objectMapper, endpointFactory);

        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);
        doAnswer(invocation -> {
            TextMessage message = invocation.getArgument(0);
            sent.add(objectMapper.readTree(message.getPayload()));
            return null;
        }).when(session).sendMessage(any());

        handler.afterConnectionEstablished(session);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        scheduler.shutdownNow();
    }

    private void receive(String payload) {
        handler.handleTextMessage(session, new TextMessage(payload));
    }

    private List<JsonNode> framesOfType(String type) {
        return sent.stream().filter(frame -> type.equals(frame.path("type").asText())).collect(Collectors.toList());
    }

    private JsonNode awaitError() {
        Await.until("error frame", () -> !framesOfType("error").isEmpty());
        return framesOfType("error").get(0);
    }

    @Test
    void join_repliesWithJoinedFrame() {
        receive("{\"action\":\"join\",\"topic\":\"room:alpha\"}");

        Await.until("joined frame", () -> !framesOfType("joined").isEmpty());
        assertEquals("alpha", framesOfType("joined").get(0).path("roomId").asText());
        assertTrue(registry.find(RoomId.of("alpha")).isPresent());
    }

    @Test
    @DisplayName("join with a topic outside the room namespace gets an error frame")
    void join_withInvalidTopic() {
        receive("{\"action\":\"join\",\"topic\":\"chat:alpha\"}");

        JsonNode error = awaitError();
        assertEquals("join", error.path("action").asText());
        assertEquals(0, engineFactory.getStarts());
    }

    @Test
    void join_withoutTopic() {
        receive("{\"action\":\"join\"}");

        JsonNode error = awaitError();
        assertEquals("join", error.path("action").asText());
        assertEquals("topic is required", error.path("message").asText());
    }

    @Test
    void malformedFrame_isReported() {
        receive("{not json");

        assertEquals("unknown", awaitError().path("action").asText());
    }

    @Test
    void missingAction_isReported() {
        receive("{\"topic\":\"room:alpha\"}");

        assertEquals("action is required", awaitError().path("message").asText());
    }

    @Test
    void unknownAction_isReported() {
        receive("{\"action\":\"dance\"}");

        JsonNode error = awaitError();
        assertEquals("dance", error.path("action").asText());
        assertEquals("Unknown action: dance", error.path("message").asText());
    }

    @Test
    void mediaEvent_beforeJoin_isReported() {
        receive("{\"action\":\"mediaEvent\",\"data\":{\"type\":\"sdpOffer\"}}");

        assertEquals("mediaEvent", awaitError().path("action").asText());
    }

    @Test
    void mediaEvent_withoutData_isReported() {
        receive("{\"action\":\"join\",\"topic\":\"room:alpha\"}");
        receive("{\"action\":\"mediaEvent\"}");

        assertEquals("data is required", awaitError().path("message").asText());
    }

    @Test
    @DisplayName("closing the connection removes the peer and the now-empty room")
    void connectionClosed_cleansUpRoom() throws Exception {
        receive("{\"action\":\"join\",\"topic\":\"room:alpha\"}");
        Await.until("joined frame", () -> !framesOfType("joined").isEmpty());

        handler.afterConnectionClosed(session, CloseStatus.GOING_AWAY);

        assertEquals(0, handler.endpointCount());
        Await.until("room removed", () -> registry.find(RoomId.of("alpha")).isEmpty());
    }

    @Test
    void leave_closesSession() throws Exception {
        receive("{\"action\":\"join\",\"topic\":\"room:alpha\"}");

        receive("{\"action\":\"leave\"}");

        Await.until("left frame", () -> !framesOfType("left").isEmpty());
        verify(session, timeout(1000)).close(any(CloseStatus.class));
    }
}
