package com.videoroom.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;

/**
 * SFU 서버가 내부 API로 전달하는 엔진 이벤트 본문.
 */
public class EngineEventRequest {

    @NotNull
    private EngineEventKind kind;

    private String target;

    private boolean broadcast;

    private JsonNode data;

    private EngineCommandKind command;

    private String reason;

    public EngineEventKind getKind() {
        return kind;
    }

    public void setKind(EngineEventKind kind) {
        this.kind = kind;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public boolean isBroadcast() {
        return broadcast;
    }

    public void setBroadcast(boolean broadcast) {
        this.broadcast = broadcast;
    }

    public JsonNode getData() {
        return data;
    }

    public void setData(JsonNode data) {
        this.data = data;
    }

    public EngineCommandKind getCommand() {
        return command;
    }

    public void setCommand(EngineCommandKind command) {
        this.command = command;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    /**
     * 요청 본문을 엔진 이벤트로 변환한다. 필수 필드가 빠져 있으면 IllegalArgumentException.
     */
    public EngineEvent toEngineEvent() {
        return switch (kind) {
            case MEDIA_EVENT -> broadcast
                    ? EngineEvent.mediaEventBroadcast(data)
                    : EngineEvent.mediaEventTo(requiredTarget(), data);
            case PEER_JOINED -> EngineEvent.peerJoined(requiredTarget());
            case PEER_LEFT -> EngineEvent.peerLeft(requiredTarget());
            case COMMAND_REJECTED -> {
                if (command == null) {
                    throw new IllegalArgumentException("command is required for COMMAND_REJECTED");
                }
                yield EngineEvent.commandRejected(command, target == null ? null : PeerId.of(target), reason);
            }
            case SHUTDOWN_ACK -> EngineEvent.shutdownAck();
            case CRASHED -> EngineEvent.crashed(reason);
        };
    }

    private PeerId requiredTarget() {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target is required for " + kind);
        }
        return PeerId.of(target);
    }
}
