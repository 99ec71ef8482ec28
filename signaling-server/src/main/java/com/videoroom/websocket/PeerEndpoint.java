package com.videoroom.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.videoroom.global.concurrent.Mailbox;
import com.videoroom.model.PeerId;
import com.videoroom.model.RoomId;
import com.videoroom.service.InvalidRoomTargetException;
import com.videoroom.service.Monitor;
import com.videoroom.service.RoomClosedException;
import com.videoroom.service.RoomCoordinator;
import com.videoroom.service.RoomPeer;
import com.videoroom.service.RoomRegistry;
import com.videoroom.service.RoomStartException;
import com.videoroom.service.RoomTargetParser;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 참가자 한 명의 연결을 방 코디네이터와 이어 준다.
 * 클라이언트 프레임은 코디네이터로, 코디네이터가 보낸 이벤트는 자신의 mailbox를 거쳐 연결로 내보낸다.
 *
 * <p>엔드포인트는 한 번만 방에 참가할 수 있고, 연결이 끊기거나 방에서 나가면 종료된다.
 * 종료 사실은 {@link #monitor(Runnable)}로 구독한 코디네이터에게만 전달되며 엔드포인트가 직접 등록을 해제하지는 않는다.
 */
public class PeerEndpoint implements RoomPeer {

    private static final Logger log = LoggerFactory.getLogger(PeerEndpoint.class);

    private static final int MAX_JOIN_ATTEMPTS = 2;

    private final PeerTransport transport;
    private final RoomRegistry roomRegistry;
    private final RoomTargetParser targetParser;
    private final ObjectMapper objectMapper;
    private final Duration joinTimeout;
    private final Mailbox outbound;

    private final List<MonitorRegistration> monitors = new CopyOnWriteArrayList<>();
    private final AtomicBoolean terminated = new AtomicBoolean();
    private volatile SessionContext session;

    // outbound mailbox 안에서만 접근한다. joined 응답 전에 도착한 이벤트를 잠시 보관한다.
    private boolean joinAnnounced;
    private final List<JsonNode> pendingEvents = new ArrayList<>();

    public PeerEndpoint(PeerTransport transport, RoomRegistry roomRegistry, RoomTargetParser targetParser,
            ObjectMapper objectMapper, Executor executor, Duration joinTimeout) {
        this.transport = transport;
        this.roomRegistry = roomRegistry;
        this.targetParser = targetParser;
        this.objectMapper = objectMapper;
        this.joinTimeout = joinTimeout;
        this.outbound = new Mailbox("peer-" + transport.getId(), executor);
    }

    public String getId() {
        return transport.getId();
    }

    /**
     * 참가 전이면 null.
     */
    public SessionContext getSession() {
        return session;
    }

    public boolean isTerminated() {
        return terminated.get();
    }

    /**
     * 토픽을 해석해 방을 찾거나 만들고, 새 PeerId로 이 엔드포인트를 등록한다.
     * 실패하면 아무것도 등록되지 않은 상태로 {@link JoinError}를 돌려준다.
     */
    public JoinResult onJoinRequest(String roomTarget) {
        if (terminated.get()) {
            return JoinResult.failure("connection is closed");
        }
        if (session != null) {
            return JoinResult.failure("already joined room " + session.getRoomId());
        }
        RoomId roomId;
        try {
            roomId = targetParser.parse(roomTarget);
        } catch (InvalidRoomTargetException ex) {
            return JoinResult.failure(ex.getMessage());
        }

        for (int attempt = 1; ; attempt++) {
            RoomCoordinator room;
            try {
                room = roomRegistry.findOrStart(roomId);
            } catch (RoomStartException ex) {
                log.warn("Join of {} to room {} failed: {}", getId(), roomId, ex.getMessage());
                return JoinResult.failure("room " + roomId + " could not be started");
            }
            PeerId peerId = PeerId.random();
            try {
                room.registerPeer(peerId, this).get(joinTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause();
                if (cause instanceof RoomClosedException && attempt < MAX_JOIN_ATTEMPTS) {
                    log.debug("Room {} closed during join of {}, retrying", roomId, getId());
                    continue;
                }
                log.warn("Join of {} to room {} failed: {}", getId(), roomId, cause.getMessage());
                return JoinResult.failure(cause.getMessage());
            } catch (TimeoutException ex) {
                // 등록이 뒤늦게 끝나더라도 종료 통지로 정리되도록 엔드포인트를 닫는다.
                log.warn("Join of {} to room {} timed out", getId(), roomId);
                terminate("join timed out");
                transport.close("join timed out");
                return JoinResult.failure("join timed out");
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                terminate("interrupted");
                return JoinResult.failure("join interrupted");
            }
            SessionContext context = new SessionContext(roomId, room, peerId);
            session = context;
            outbound.post(() -> announceJoin(context));
            log.info("Endpoint {} joined room {} as {}", getId(), roomId, peerId);
            return JoinResult.success(context);
        }
    }

    /**
     * 클라이언트가 보낸 미디어 이벤트를 방으로 넘긴다.
     *
     * @throws IllegalStateException 아직 방에 참가하지 않았을 때
     */
    public void onInboundClientEvent(JsonNode payload) {
        SessionContext context = session;
        if (context == null || terminated.get()) {
            throw new IllegalStateException("join a room before sending media events");
        }
        context.getRoom().relayClientEvent(context.getPeerId(), payload);
    }

    @Override
    public void onRoomEvent(JsonNode payload) {
        outbound.post(() -> {
            if (!joinAnnounced) {
                pendingEvents.add(payload);
                return;
            }
            sendFrame(mediaEventFrame(payload));
        });
    }

    @Override
    public Monitor monitor(Runnable onTerminated) {
        MonitorRegistration registration = new MonitorRegistration(onTerminated);
        monitors.add(registration);
        if (terminated.get()) {
            registration.fire();
        }
        return registration;
    }

    @Override
    public void disconnect(String reason) {
        outbound.post(() -> {
            sendFrame(errorFrame("room", reason));
            transport.close(reason);
            terminate(reason);
        });
    }

    /**
     * 클라이언트가 스스로 방을 떠난다. 연결도 함께 닫는다.
     */
    public void leave() {
        outbound.post(() -> {
            ObjectNode frame = objectMapper.createObjectNode();
            frame.put("type", "left");
            SessionContext context = session;
            if (context != null) {
                frame.put("roomId", context.getRoomId().getValue());
            }
            sendFrame(frame);
            terminate("left room");
            transport.close("left room");
        });
    }

    /**
     * 요청 처리 중 발생한 오류를 클라이언트에게 알린다.
     */
    public void sendError(String action, String message) {
        outbound.post(() -> sendFrame(errorFrame(action, message)));
    }

    /**
     * 엔드포인트를 종료하고 감시 중인 코디네이터에게 알린다. 두 번째 호출부터는 아무 일도 하지 않는다.
     */
    public void terminate(String reason) {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        log.debug("Endpoint {} terminated: {}", getId(), reason);
        for (MonitorRegistration registration : monitors) {
            registration.fire();
        }
        monitors.clear();
        outbound.post(pendingEvents::clear);
        outbound.close();
    }

    private void announceJoin(SessionContext context) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "joined");
        frame.put("roomId", context.getRoomId().getValue());
        frame.put("peerId", context.getPeerId().getValue());
        sendFrame(frame);
        joinAnnounced = true;
        pendingEvents.forEach(payload -> sendFrame(mediaEventFrame(payload)));
        pendingEvents.clear();
    }

    private ObjectNode mediaEventFrame(JsonNode payload) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "mediaEvent");
        frame.set("data", payload);
        return frame;
    }

    private ObjectNode errorFrame(String action, String message) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "error");
        frame.put("action", action);
        frame.put("message", message);
        return frame;
    }

    private void sendFrame(ObjectNode frame) {
        if (!transport.isOpen()) {
            log.debug("Endpoint {} transport closed, dropping {}", getId(), frame.path("type").asText());
            return;
        }
        try {
            transport.send(frame);
        } catch (IOException | IllegalStateException ex) {
            log.warn("Failed to send to endpoint {}: {}", getId(), ex.getMessage());
            terminate("send failed");
        }
    }

    private class MonitorRegistration implements Monitor {
        private final Runnable onTerminated;
        private final AtomicBoolean done = new AtomicBoolean();

        private MonitorRegistration(Runnable onTerminated) {
            this.onTerminated = onTerminated;
        }

        private void fire() {
            if (done.compareAndSet(false, true)) {
                onTerminated.run();
            }
        }

        @Override
        public void cancel() {
            done.set(true);
            monitors.remove(this);
        }
    }
}
