package com.videoroom.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * 미디어 엔진이 내보내는 이벤트. 대상은 특정 참가자이거나 방 전체(broadcast)다.
 */
public final class EngineEvent {

    private final EngineEventKind kind;
    private final PeerId target;
    private final boolean broadcast;
    private final JsonNode payload;
    private final EngineCommandKind rejectedCommand;
    private final String reason;

    private EngineEvent(EngineEventKind kind, PeerId target, boolean broadcast, JsonNode payload,
            EngineCommandKind rejectedCommand, String reason) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.target = target;
        this.broadcast = broadcast;
        this.payload = payload;
        this.rejectedCommand = rejectedCommand;
        this.reason = reason;
    }

    public static EngineEvent mediaEventTo(PeerId target, JsonNode payload) {
        return new EngineEvent(EngineEventKind.MEDIA_EVENT, Objects.requireNonNull(target), false, payload, null, null);
    }

    public static EngineEvent mediaEventBroadcast(JsonNode payload) {
        return new EngineEvent(EngineEventKind.MEDIA_EVENT, null, true, payload, null, null);
    }

    public static EngineEvent peerJoined(PeerId peerId) {
        return new EngineEvent(EngineEventKind.PEER_JOINED, peerId, false, null, null, null);
    }

    public static EngineEvent peerLeft(PeerId peerId) {
        return new EngineEvent(EngineEventKind.PEER_LEFT, peerId, false, null, null, null);
    }

    public static EngineEvent commandRejected(EngineCommandKind command, PeerId peerId, String reason) {
        return new EngineEvent(EngineEventKind.COMMAND_REJECTED, peerId, false, null,
                Objects.requireNonNull(command), reason);
    }

    public static EngineEvent shutdownAck() {
        return new EngineEvent(EngineEventKind.SHUTDOWN_ACK, null, false, null, null, null);
    }

    public static EngineEvent crashed(String reason) {
        return new EngineEvent(EngineEventKind.CRASHED, null, false, null, null, reason);
    }

    public EngineEventKind getKind() {
        return kind;
    }

    public PeerId getTarget() {
        return target;
    }

    public boolean isBroadcast() {
        return broadcast;
    }

    public JsonNode getPayload() {
        return payload;
    }

    /**
     * COMMAND_REJECTED 이벤트에서 거부된 명령 종류.
     */
    public EngineCommandKind getRejectedCommand() {
        return rejectedCommand;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        String to = broadcast ? "broadcast" : String.valueOf(target);
        return kind + " -> " + to + (reason == null ? "" : " (" + reason + ")");
    }
}
