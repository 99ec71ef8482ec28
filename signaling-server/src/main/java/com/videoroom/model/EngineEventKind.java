package com.videoroom.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 미디어 엔진이 코디네이터에게 보내는 이벤트 종류.
 */
public enum EngineEventKind {
    MEDIA_EVENT,
    PEER_JOINED,
    PEER_LEFT,
    COMMAND_REJECTED,
    SHUTDOWN_ACK,
    CRASHED;

    @JsonCreator
    public static EngineEventKind fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (EngineEventKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown engine event kind: " + value);
    }

    @JsonValue
    public String toValue() {
        return name();
    }
}
