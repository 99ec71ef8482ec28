package com.videoroom.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * 코디네이터가 미디어 엔진에 보내는 단방향 명령.
 */
public final class EngineCommand {

    private final EngineCommandKind kind;
    private final PeerId peerId;
    private final JsonNode payload;

    private EngineCommand(EngineCommandKind kind, PeerId peerId, JsonNode payload) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.peerId = peerId;
        this.payload = payload;
    }

    public static EngineCommand addPeer(PeerId peerId) {
        return new EngineCommand(EngineCommandKind.ADD_PEER, Objects.requireNonNull(peerId), null);
    }

    public static EngineCommand removePeer(PeerId peerId) {
        return new EngineCommand(EngineCommandKind.REMOVE_PEER, Objects.requireNonNull(peerId), null);
    }

    public static EngineCommand mediaEvent(PeerId peerId, JsonNode payload) {
        return new EngineCommand(EngineCommandKind.MEDIA_EVENT, Objects.requireNonNull(peerId), payload);
    }

    public static EngineCommand shutdown() {
        return new EngineCommand(EngineCommandKind.SHUTDOWN, null, null);
    }

    public EngineCommandKind getKind() {
        return kind;
    }

    /**
     * SHUTDOWN 명령이면 null.
     */
    public PeerId getPeerId() {
        return peerId;
    }

    public JsonNode getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return kind + (peerId == null ? "" : "(" + peerId + ")");
    }
}
