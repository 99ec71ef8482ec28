package com.videoroom.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.videoroom.config.SignalingProperties;
import com.videoroom.service.RoomRegistry;
import com.videoroom.service.RoomTargetParser;
import java.time.Duration;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * 새 연결마다 {@link PeerEndpoint}를 만든다.
 */
@Component
public class PeerEndpointFactory {

    private final RoomRegistry roomRegistry;
    private final RoomTargetParser targetParser;
    private final ObjectMapper objectMapper;
    private final Executor actorExecutor;
    private final Duration joinTimeout;

    public PeerEndpointFactory(RoomRegistry roomRegistry, RoomTargetParser targetParser, ObjectMapper objectMapper,
            @Qualifier("actorExecutor") Executor actorExecutor, SignalingProperties properties) {
        this.roomRegistry = roomRegistry;
        this.targetParser = targetParser;
        this.objectMapper = objectMapper;
        this.actorExecutor = actorExecutor;
        this.joinTimeout = properties.getStartTimeout();
    }

    public PeerEndpoint create(PeerTransport transport) {
        return new PeerEndpoint(transport, roomRegistry, targetParser, objectMapper, actorExecutor, joinTimeout);
    }
}
