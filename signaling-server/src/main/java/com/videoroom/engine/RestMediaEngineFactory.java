package com.videoroom.engine;

import com.videoroom.config.MediaEngineProperties;
import com.videoroom.model.EngineEvent;
import com.videoroom.model.RoomId;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * 방마다 {@link RestMediaEngine}을 만들고, SFU에서 들어오는 이벤트를 살아 있는 엔진에 연결한다.
 */
@Component
@ConditionalOnProperty(prefix = "signaling.engine", name = "type", havingValue = "rest", matchIfMissing = true)
public class RestMediaEngineFactory implements MediaEngineFactory, EngineEventRouter {

    private static final Logger log = LoggerFactory.getLogger(RestMediaEngineFactory.class);

    private final RestTemplate restTemplate;
    private final MediaEngineProperties properties;
    private final Executor actorExecutor;
    private final Map<RoomId, RestMediaEngine> engines = new ConcurrentHashMap<>();
    // 닫혔지만 아직 보내지 못한 SFU 호출이 남아 있는 엔진
    private final Map<RoomId, RestMediaEngine> retiring = new ConcurrentHashMap<>();

    public RestMediaEngineFactory(RestTemplate restTemplate, MediaEngineProperties properties,
            @Qualifier("actorExecutor") Executor actorExecutor) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.actorExecutor = actorExecutor;
    }

    /**
     * 같은 방의 이전 엔진이 남은 호출(DELETE /rooms/{room} 등)을 다 보낸 뒤에 새 SFU 방을 만든다.
     */
    @Override
    public MediaEngine start(RoomId roomId) {
        awaitPredecessor(roomId);
        RestMediaEngine engine = new RestMediaEngine(roomId, restTemplate, properties, actorExecutor,
                this::onEngineClosed);
        engine.open();
        engines.put(roomId, engine);
        log.debug("SFU engine bound for room {}", roomId);
        return engine;
    }

    private void onEngineClosed(RestMediaEngine engine) {
        RoomId roomId = engine.getRoomId();
        engines.remove(roomId, engine);
        retiring.put(roomId, engine);
        engine.whenDrained().thenRun(() -> retiring.remove(roomId, engine));
    }

    private void awaitPredecessor(RoomId roomId) {
        RestMediaEngine previous = retiring.get(roomId);
        if (previous == null) {
            return;
        }
        Duration bound = properties.getConnectTimeout().plus(properties.getResponseTimeout());
        log.debug("Waiting for previous SFU engine of room {} to drain", roomId);
        try {
            previous.whenDrained().get(bound.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.warn("Previous SFU engine of room {} still busy after {}, opening anyway", roomId, bound);
        } catch (ExecutionException ex) {
            log.warn("Previous SFU engine of room {} failed to drain: {}", roomId, ex.getCause().getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new MediaEngineException("Interrupted while waiting for previous engine of room " + roomId, ex);
        }
    }

    @Override
    public boolean route(RoomId roomId, EngineEvent event) {
        RestMediaEngine engine = engines.get(roomId);
        if (engine == null || engine.isClosed()) {
            log.debug("No live engine for room {}, dropping {}", roomId, event);
            return false;
        }
        engine.publish(event);
        return true;
    }
}
