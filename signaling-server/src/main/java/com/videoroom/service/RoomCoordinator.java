package com.videoroom.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.videoroom.engine.MediaEngine;
import com.videoroom.engine.MediaEngineException;
import com.videoroom.engine.MediaEngineFactory;
import com.videoroom.global.concurrent.Mailbox;
import com.videoroom.model.EngineCommand;
import com.videoroom.model.EngineCommandKind;
import com.videoroom.model.EngineEvent;
import com.videoroom.model.PeerId;
import com.videoroom.model.RoomId;
import com.videoroom.model.RoomState;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 방 하나의 참가자 목록과 미디어 엔진을 소유하고 둘 사이의 이벤트를 중계한다.
 * 모든 상태 변경은 자신의 {@link Mailbox} 안에서 순서대로 처리되므로 별도의 잠금이 없다.
 *
 * <p>상태는 STARTING → ACTIVE → TERMINATING → TERMINATED 순으로만 진행한다.
 * 마지막 참가자가 나가면 엔진에 종료를 요청하고, 응답이 오거나 제한 시간이 지나면
 * 레지스트리에서 스스로를 제거한다.
 */
public class RoomCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RoomCoordinator.class);

    private final RoomId id;
    private final MediaEngineFactory engineFactory;
    private final ScheduledExecutorService scheduler;
    private final Duration shutdownTimeout;
    private final Consumer<RoomCoordinator> terminationListener;
    private final Mailbox mailbox;
    private final Instant createdAt = Instant.now();
    private final CompletableFuture<RoomCoordinator> started = new CompletableFuture<>();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    // 아래 필드는 mailbox 안에서만 접근한다.
    private final Map<PeerId, PeerHandle> peers = new HashMap<>();
    private MediaEngine engine;
    private Flow.Subscription engineSubscription;
    private ScheduledFuture<?> shutdownTimer;

    // 다른 스레드에서 조회만 하므로 volatile로 둔다.
    private volatile RoomState state = RoomState.STARTING;
    private volatile boolean closeRequested;

    public RoomCoordinator(RoomId id, MediaEngineFactory engineFactory, Executor executor,
            ScheduledExecutorService scheduler, Duration shutdownTimeout,
            Consumer<RoomCoordinator> terminationListener) {
        this.id = id;
        this.engineFactory = engineFactory;
        this.scheduler = scheduler;
        this.shutdownTimeout = shutdownTimeout;
        this.terminationListener = terminationListener;
        this.mailbox = new Mailbox("room-" + id, executor);
    }

    public RoomId getId() {
        return id;
    }

    public RoomState getState() {
        return state;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * 아직 참가자를 받을 수 있거나 곧 받을 수 있는 상태인지 여부. 닫기가 요청된 방은 제외한다.
     */
    public boolean isLive() {
        return !closeRequested && (state == RoomState.STARTING || state == RoomState.ACTIVE);
    }

    /**
     * 엔진을 띄우고 ACTIVE로 전환한다. 반환된 future는 실패 시 {@link RoomStartException}으로 완료된다.
     */
    CompletableFuture<RoomCoordinator> start() {
        if (!mailbox.post(this::doStart)) {
            started.completeExceptionally(new RoomStartException(id, "Room " + id + " was closed before start", null));
        }
        return started;
    }

    /**
     * 같은 방 ID의 이전 코디네이터가 종료된 뒤에 시작한다. 이전 엔진의 종료 호출이 새 엔진의
     * 생성 호출보다 먼저 나가야 한다. 최대 {@code maxWait}까지만 기다린다.
     */
    CompletableFuture<RoomCoordinator> startAfter(RoomCoordinator predecessor, Duration maxWait) {
        if (predecessor == null || predecessor.whenTerminated().isDone()) {
            return start();
        }
        log.info("Room {} waits for the previous coordinator to terminate", id);
        predecessor.whenTerminated().copy()
                .completeOnTimeout(null, maxWait.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, ex) -> {
                    if (!predecessor.whenTerminated().isDone()) {
                        log.warn("Previous coordinator of room {} did not terminate within {}, starting anyway",
                                id, maxWait);
                    }
                    start();
                });
        return started;
    }

    CompletableFuture<RoomCoordinator> whenStarted() {
        return started;
    }

    /**
     * TERMINATED 상태가 되면 완료된다.
     */
    public CompletableFuture<Void> whenTerminated() {
        return terminated;
    }

    /**
     * 참가자를 방에 등록하고 엔진에 add-peer를 보낸다.
     * 방이 종료 중이면 {@link RoomClosedException}, 엔진이 즉시 거부하면 {@link MediaEngineException}으로 완료된다.
     */
    public CompletableFuture<Void> registerPeer(PeerId peerId, RoomPeer peer) {
        CompletableFuture<Void> admitted = new CompletableFuture<>();
        if (!mailbox.post(() -> doRegisterPeer(peerId, peer, admitted))) {
            admitted.completeExceptionally(new RoomClosedException(id));
        }
        return admitted;
    }

    /**
     * 참가자가 보낸 이벤트를 엔진으로 전달한다. 이미 나간 참가자의 이벤트는 버린다.
     */
    public void relayClientEvent(PeerId peerId, JsonNode payload) {
        mailbox.post(() -> doRelayClientEvent(peerId, payload));
    }

    /**
     * 참가자 목록의 스냅샷. 종료된 방이면 빈 집합이다.
     */
    public CompletableFuture<Set<PeerId>> peers() {
        CompletableFuture<Set<PeerId>> snapshot = new CompletableFuture<>();
        if (!mailbox.post(() -> snapshot.complete(Set.copyOf(peers.keySet())))) {
            snapshot.complete(Set.of());
        }
        return snapshot;
    }

    /**
     * 남은 참가자를 모두 내보내고 방을 닫는다.
     */
    public void close(String reason) {
        closeRequested = true;
        mailbox.post(() -> doClose(reason));
    }

    private void doStart() {
        if (state != RoomState.STARTING) {
            return;
        }
        if (closeRequested) {
            finishTermination("closed before start");
            started.completeExceptionally(new RoomStartException(id, "Room " + id + " was closed before start", null));
            return;
        }
        try {
            engine = engineFactory.start(id);
        } catch (RuntimeException ex) {
            log.warn("Media engine failed to start for room {}: {}", id, ex.getMessage(), ex);
            finishTermination("engine failed to start");
            started.completeExceptionally(new RoomStartException(id,
                    "Media engine failed to start for room " + id + ": " + ex.getMessage(), ex));
            return;
        }
        engine.events().subscribe(new EngineEventSubscriber());
        state = RoomState.ACTIVE;
        if (closeRequested) {
            // 엔진은 떠 있으므로 종료 절차를 거쳐 SFU 쪽 자원도 정리한다.
            log.info("Room {} was closed while starting", id);
            started.completeExceptionally(new RoomStartException(id, "Room " + id + " was closed while starting", null));
            beginTermination();
            return;
        }
        log.info("Room {} started", id);
        started.complete(this);
    }

    private void doRegisterPeer(PeerId peerId, RoomPeer peer, CompletableFuture<Void> admitted) {
        if (!state.acceptsPeers()) {
            admitted.completeExceptionally(new RoomClosedException(id));
            return;
        }
        if (peers.containsKey(peerId)) {
            admitted.completeExceptionally(new IllegalStateException("Peer " + peerId + " is already in room " + id));
            return;
        }
        Monitor monitor = peer.monitor(() -> mailbox.post(() -> onPeerLivenessLost(peerId)));
        peers.put(peerId, new PeerHandle(peerId, peer, monitor));
        try {
            engine.command(EngineCommand.addPeer(peerId));
        } catch (MediaEngineException ex) {
            log.warn("Media engine rejected add-peer {} in room {}: {}", peerId, id, ex.getMessage());
            peers.remove(peerId);
            monitor.cancel();
            admitted.completeExceptionally(ex);
            terminateIfEmpty();
            return;
        }
        log.info("Peer {} joined room {} ({} peers)", peerId, id, peers.size());
        admitted.complete(null);
    }

    private void doRelayClientEvent(PeerId peerId, JsonNode payload) {
        if (state != RoomState.ACTIVE || !peers.containsKey(peerId)) {
            log.debug("Dropping client event from unknown peer {} in room {}", peerId, id);
            return;
        }
        sendToEngine(EngineCommand.mediaEvent(peerId, payload));
    }

    private void onEngineEvent(EngineEvent event) {
        if (state == RoomState.TERMINATED) {
            log.debug("Room {} already terminated, ignoring {}", id, event);
            return;
        }
        switch (event.getKind()) {
            case MEDIA_EVENT -> deliver(event);
            case PEER_JOINED, PEER_LEFT -> log.debug("Engine of room {} reported {}", id, event);
            case COMMAND_REJECTED -> onCommandRejected(event);
            case SHUTDOWN_ACK -> {
                if (state == RoomState.TERMINATING) {
                    finishTermination("engine acknowledged shutdown");
                }
            }
            case CRASHED -> onEngineFailure(event.getReason() == null ? "engine crashed" : event.getReason());
        }
    }

    private void deliver(EngineEvent event) {
        if (event.isBroadcast()) {
            for (PeerHandle handle : peers.values()) {
                pushTo(handle, event.getPayload());
            }
            return;
        }
        PeerHandle handle = peers.get(event.getTarget());
        if (handle == null) {
            log.debug("Dropping engine event for unknown peer {} in room {}", event.getTarget(), id);
            return;
        }
        pushTo(handle, event.getPayload());
    }

    private void pushTo(PeerHandle handle, JsonNode payload) {
        try {
            handle.peer.onRoomEvent(payload);
        } catch (RuntimeException ex) {
            log.warn("Failed to hand event to peer {} in room {}", handle.peerId, id, ex);
        }
    }

    private void onCommandRejected(EngineEvent event) {
        log.warn("Media engine of room {} rejected {} for peer {}: {}",
                id, event.getRejectedCommand(), event.getTarget(), event.getReason());
        if (event.getRejectedCommand() == EngineCommandKind.ADD_PEER && event.getTarget() != null) {
            PeerHandle handle = peers.remove(event.getTarget());
            if (handle != null) {
                handle.monitor.cancel();
                handle.peer.disconnect("media engine rejected peer");
                terminateIfEmpty();
            }
        } else if (event.getRejectedCommand() == EngineCommandKind.SHUTDOWN && state == RoomState.TERMINATING) {
            finishTermination("engine rejected shutdown");
        }
    }

    private void onPeerLivenessLost(PeerId peerId) {
        PeerHandle handle = peers.remove(peerId);
        if (handle == null) {
            return;
        }
        handle.monitor.cancel();
        log.info("Peer {} left room {} ({} peers)", peerId, id, peers.size());
        if (state == RoomState.ACTIVE) {
            sendToEngine(EngineCommand.removePeer(peerId));
        }
        terminateIfEmpty();
    }

    // 엔진이 살아 있는데 참가자가 남아 있으면 모두 끊고 바로 종료한다.
    private void onEngineFailure(String reason) {
        log.error("Media engine of room {} failed: {}", id, reason);
        disconnectAll("media engine failed");
        finishTermination(reason);
    }

    private void doClose(String reason) {
        if (state == RoomState.TERMINATED || state == RoomState.TERMINATING) {
            return;
        }
        disconnectAll(reason);
        if (state == RoomState.STARTING) {
            finishTermination(reason);
            return;
        }
        beginTermination();
    }

    private void disconnectAll(String reason) {
        List<PeerHandle> handles = new ArrayList<>(peers.values());
        peers.clear();
        for (PeerHandle handle : handles) {
            handle.monitor.cancel();
            try {
                handle.peer.disconnect(reason);
            } catch (RuntimeException ex) {
                log.warn("Failed to disconnect peer {} in room {}", handle.peerId, id, ex);
            }
        }
    }

    private void terminateIfEmpty() {
        if (state == RoomState.ACTIVE && peers.isEmpty()) {
            beginTermination();
        }
    }

    private void beginTermination() {
        state = RoomState.TERMINATING;
        log.info("Room {} is terminating, shutting down media engine", id);
        try {
            engine.command(EngineCommand.shutdown());
        } catch (MediaEngineException ex) {
            log.warn("Media engine of room {} refused shutdown: {}", id, ex.getMessage());
            finishTermination("shutdown refused");
            return;
        }
        shutdownTimer = scheduler.schedule(() -> mailbox.post(this::onShutdownTimeout),
                shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onShutdownTimeout() {
        if (state == RoomState.TERMINATING) {
            log.warn("Media engine of room {} did not acknowledge shutdown within {}", id, shutdownTimeout);
            finishTermination("shutdown timed out");
        }
    }

    private void finishTermination(String reason) {
        if (state == RoomState.TERMINATED) {
            return;
        }
        state = RoomState.TERMINATED;
        mailbox.close();
        if (shutdownTimer != null) {
            shutdownTimer.cancel(false);
        }
        if (engineSubscription != null) {
            engineSubscription.cancel();
        }
        if (engine != null) {
            try {
                engine.close();
            } catch (RuntimeException ex) {
                log.warn("Failed to close media engine of room {}", id, ex);
            }
        }
        terminationListener.accept(this);
        log.info("Room {} terminated: {}", id, reason);
        terminated.complete(null);
    }

    private void sendToEngine(EngineCommand command) {
        try {
            engine.command(command);
        } catch (MediaEngineException ex) {
            log.warn("Media engine of room {} rejected {}: {}", id, command, ex.getMessage());
        }
    }

    /**
     * 엔진 이벤트를 코디네이터의 mailbox로 옮긴다.
     */
    private class EngineEventSubscriber implements Flow.Subscriber<EngineEvent> {

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            mailbox.post(() -> engineSubscription = subscription);
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(EngineEvent event) {
            mailbox.post(() -> onEngineEvent(event));
        }

        @Override
        public void onError(Throwable throwable) {
            mailbox.post(() -> {
                if (state != RoomState.TERMINATED) {
                    onEngineFailure("engine event stream failed: " + throwable.getMessage());
                }
            });
        }

        @Override
        public void onComplete() {
            mailbox.post(() -> {
                if (state == RoomState.ACTIVE) {
                    onEngineFailure("engine event stream ended");
                } else if (state == RoomState.TERMINATING) {
                    finishTermination("engine event stream ended");
                }
            });
        }
    }

    private static class PeerHandle {
        private final PeerId peerId;
        private final RoomPeer peer;
        private final Monitor monitor;

        private PeerHandle(PeerId peerId, RoomPeer peer, Monitor monitor) {
            this.peerId = peerId;
            this.peer = peer;
            this.monitor = monitor;
        }
    }
}
