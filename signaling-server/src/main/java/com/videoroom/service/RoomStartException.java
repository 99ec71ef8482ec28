package com.videoroom.service;

import com.videoroom.model.RoomId;

/**
 * 방 코디네이터 또는 그 미디어 엔진이 시작되지 못했을 때 던진다.
 */
public class RoomStartException extends RuntimeException {

    private final RoomId roomId;

    public RoomStartException(RoomId roomId, String message, Throwable cause) {
        super(message, cause);
        this.roomId = roomId;
    }

    public RoomId getRoomId() {
        return roomId;
    }
}
