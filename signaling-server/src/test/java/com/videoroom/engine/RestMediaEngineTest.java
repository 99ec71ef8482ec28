package com.videoroom.engine;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.videoroom.config.MediaEngineProperties;
import com.videoroom.engine.LoopbackMediaEngineTest.CollectingSubscriber;
import com.videoroom.model.EngineCommand;
import com.videoroom.model.EngineCommandKind;
import com.videoroom.model.EngineEvent;
import com.videoroom.model.EngineEventKind;
import com.videoroom.model.PeerId;
import com.videoroom.model.RoomId;
import java.net.URI;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class RestMediaEngineTest {

    private static final String SFU = "http://sfu.test";

    // 명령을 호출한 스레드에서 바로 실행해 요청 순서를 결정적으로 만든다.
    private final Executor direct = Runnable::run;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<EngineEvent> events = new CopyOnWriteArrayList<>();

    private RestTemplate restTemplate;
    private MediaEngineProperties properties;
    private MockRestServiceServer server;
    private RestMediaEngineFactory factory;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new MediaEngineProperties();
        properties.setSfuServerUrl(URI.create(SFU + "/"));
        factory = new RestMediaEngineFactory(restTemplate, properties, direct);
    }

    private MediaEngine startEngine() {
        server.expect(requestTo(SFU + "/rooms"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"roomId\":\"alpha\"}"))
                .andRespond(withSuccess("{\"roomId\":\"alpha\"}", MediaType.APPLICATION_JSON));
        MediaEngine engine = factory.start(RoomId.of("alpha"));
        engine.events().subscribe(new CollectingSubscriber(events));
        return engine;
    }

    @Test
    void start_createsRoomOnSfu() {
        startEngine();

        server.verify();
    }

    @Test
    void start_whenSfuFails_throwsMediaEngineException() {
        server.expect(requestTo(SFU + "/rooms")).andRespond(withServerError());

        assertThrows(MediaEngineException.class, () -> factory.start(RoomId.of("alpha")));
        assertFalse(factory.route(RoomId.of("alpha"), EngineEvent.shutdownAck()));
    }

    @Test
    void commands_areSentAsSfuCalls() throws Exception {
        MediaEngine engine = startEngine();
        server.expect(requestTo(SFU + "/rooms/alpha/peers"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"peerId\":\"p1\"}"))
                .andRespond(withSuccess());
        server.expect(requestTo(SFU + "/rooms/alpha/peers/p1/media-events"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"data\":{\"type\":\"sdpOffer\",\"sdp\":\"v=0\"}}"))
                .andRespond(withSuccess());
        server.expect(requestTo(SFU + "/rooms/alpha/peers/p1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withNoContent());

        engine.command(EngineCommand.addPeer(PeerId.of("p1")));
        engine.command(EngineCommand.mediaEvent(PeerId.of("p1"),
                objectMapper.readTree("{\"type\":\"sdpOffer\",\"sdp\":\"v=0\"}")));
        engine.command(EngineCommand.removePeer(PeerId.of("p1")));

        server.verify();
        assertTrue(events.isEmpty());
    }

    @Test
    void failedCall_isReportedAsCommandRejected() {
        MediaEngine engine = startEngine();
        server.expect(requestTo(SFU + "/rooms/alpha/peers")).andRespond(withServerError());

        engine.command(EngineCommand.addPeer(PeerId.of("p1")));

        assertEquals(1, events.size());
        EngineEvent rejected = events.get(0);
        assertEquals(EngineEventKind.COMMAND_REJECTED, rejected.getKind());
        assertEquals(EngineCommandKind.ADD_PEER, rejected.getRejectedCommand());
        assertEquals(PeerId.of("p1"), rejected.getTarget());
    }

    @Test
    void shutdown_deletesRoomAndAcknowledges() {
        MediaEngine engine = startEngine();
        server.expect(requestTo(SFU + "/rooms/alpha"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withNoContent());

        engine.command(EngineCommand.shutdown());

        server.verify();
        assertEquals(List.of(EngineEventKind.SHUTDOWN_ACK), events.stream().map(EngineEvent::getKind).toList());
        assertThrows(MediaEngineException.class, () -> engine.command(EngineCommand.addPeer(PeerId.of("p2"))));
    }

    @Test
    void route_deliversToLiveEngineUntilClosed() {
        MediaEngine engine = startEngine();

        assertTrue(factory.route(RoomId.of("alpha"), EngineEvent.mediaEventBroadcast(objectMapper.createObjectNode())));
        assertFalse(factory.route(RoomId.of("beta"), EngineEvent.shutdownAck()));

        engine.close();

        assertFalse(factory.route(RoomId.of("alpha"), EngineEvent.shutdownAck()));
        assertEquals(1, events.size());
    }

    @Test
    @DisplayName("reopening a room waits until the previous engine has deleted its SFU room")
    void reopen_waitsForPreviousEngineToDrain() throws Exception {
        Queue<Runnable> pending = new ConcurrentLinkedQueue<>();
        RestMediaEngineFactory queued = new RestMediaEngineFactory(restTemplate, properties, pending::add);
        server.expect(requestTo(SFU + "/rooms"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess());
        server.expect(requestTo(SFU + "/rooms/alpha"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withNoContent());
        server.expect(requestTo(SFU + "/rooms"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess());
        MediaEngine previous = queued.start(RoomId.of("alpha"));
        previous.command(EngineCommand.shutdown());
        previous.close();

        CompletableFuture<MediaEngine> reopened = CompletableFuture.supplyAsync(() -> queued.start(RoomId.of("alpha")));
        Thread.sleep(200);
        assertFalse(reopened.isDone());

        Runnable task;
        while ((task = pending.poll()) != null) {
            task.run();
        }

        assertNotNull(reopened.get(2, TimeUnit.SECONDS));
        server.verify();
    }
}
