package com.videoroom.service;

import com.videoroom.config.SignalingProperties;
import com.videoroom.engine.MediaEngineFactory;
import com.videoroom.model.RoomId;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * RoomId → RoomCoordinator 매핑을 관리한다.
 * 매핑은 {@link #findOrStart(RoomId)}와 코디네이터 종료 통지로만 바뀐다.
 */
@Component
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final ConcurrentMap<RoomId, RoomCoordinator> rooms = new ConcurrentHashMap<>();
    // 매핑에서는 빠졌지만 아직 종료 중인 코디네이터. 같은 방의 새 코디네이터는 이들이 끝난 뒤에 시작한다.
    private final ConcurrentMap<RoomId, RoomCoordinator> retiring = new ConcurrentHashMap<>();

    private final MediaEngineFactory engineFactory;
    private final Executor actorExecutor;
    private final ScheduledExecutorService actorScheduler;
    private final Duration startTimeout;
    private final Duration shutdownTimeout;

    public RoomRegistry(MediaEngineFactory engineFactory,
            @Qualifier("actorExecutor") Executor actorExecutor,
            @Qualifier("actorScheduler") ScheduledExecutorService actorScheduler,
            SignalingProperties properties) {
        this.engineFactory = engineFactory;
        this.actorExecutor = actorExecutor;
        this.actorScheduler = actorScheduler;
        this.startTimeout = properties.getStartTimeout();
        this.shutdownTimeout = properties.getShutdownTimeout();
    }

    /**
     * 살아 있는 코디네이터가 있으면 그대로 반환하고, 없으면 새로 만들어 등록한 뒤 시작한다.
     * 등록은 putIfAbsent/replace 한 번으로 이뤄지므로 같은 방에 대해 동시에 호출되어도
     * 시작되는 코디네이터는 하나뿐이다.
     *
     * @throws RoomStartException 코디네이터가 시작되지 못했을 때. 이 경우 매핑은 남지 않는다.
     */
    public RoomCoordinator findOrStart(RoomId roomId) {
        RoomCoordinator coordinator = claim(roomId);
        return awaitStarted(coordinator);
    }

    private RoomCoordinator claim(RoomId roomId) {
        while (true) {
            RoomCoordinator existing = rooms.get(roomId);
            if (existing != null && existing.isLive()) {
                return existing;
            }
            RoomCoordinator fresh = new RoomCoordinator(roomId, engineFactory, actorExecutor, actorScheduler,
                    shutdownTimeout, this::onCoordinatorTerminated);
            boolean registered = existing == null
                    ? rooms.putIfAbsent(roomId, fresh) == null
                    : rooms.replace(roomId, existing, fresh);
            if (registered) {
                if (existing != null) {
                    log.debug("Replacing closing coordinator of room {}", roomId);
                }
                RoomCoordinator predecessor = existing != null ? existing : retiring.get(roomId);
                log.info("Starting coordinator for room {}", roomId);
                fresh.startAfter(predecessor, startTimeout.plus(shutdownTimeout));
                return fresh;
            }
            // 다른 스레드가 먼저 등록했다. 다시 조회한다.
        }
    }

    private RoomCoordinator awaitStarted(RoomCoordinator coordinator) {
        RoomId roomId = coordinator.getId();
        try {
            return coordinator.whenStarted().get(startTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof RoomStartException) {
                throw (RoomStartException) ex.getCause();
            }
            throw new RoomStartException(roomId, "Room " + roomId + " failed to start", ex.getCause());
        } catch (TimeoutException ex) {
            retire(coordinator, "start timed out");
            throw new RoomStartException(roomId, "Room " + roomId + " did not start within " + startTimeout, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RoomStartException(roomId, "Interrupted while starting room " + roomId, ex);
        }
    }

    // 시작이 늦어진 코디네이터를 매핑에서 빼고 닫는다. 엔진이 뒤늦게 뜨더라도 종료 절차를 밟는다.
    private void retire(RoomCoordinator coordinator, String reason) {
        RoomId roomId = coordinator.getId();
        coordinator.close(reason);
        if (rooms.remove(roomId, coordinator)) {
            log.warn("Room {} removed from registry: {}", roomId, reason);
            retiring.put(roomId, coordinator);
            coordinator.whenTerminated().thenRun(() -> retiring.remove(roomId, coordinator));
        }
    }

    /**
     * 종료된 코디네이터의 매핑을 제거한다. 같은 방 ID에 이미 새 코디네이터가 등록되어 있으면
     * 건드리지 않으며, 여러 번 호출해도 결과는 같다.
     */
    public void onCoordinatorTerminated(RoomCoordinator coordinator) {
        if (rooms.remove(coordinator.getId(), coordinator)) {
            log.info("Room {} removed from registry", coordinator.getId());
        } else {
            log.debug("Room {} was not registered to this coordinator", coordinator.getId());
        }
    }

    public Optional<RoomCoordinator> find(RoomId roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public List<RoomCoordinator> activeRooms() {
        return List.copyOf(rooms.values());
    }

    @PreDestroy
    public void closeAll() {
        rooms.values().forEach(coordinator -> coordinator.close("server shutting down"));
    }
}
