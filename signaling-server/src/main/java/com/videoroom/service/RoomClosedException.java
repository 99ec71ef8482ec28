package com.videoroom.service;

import com.videoroom.model.RoomId;

/**
 * 종료 중이거나 이미 종료된 방에 참가하려 할 때 던진다.
 */
public class RoomClosedException extends RuntimeException {

    private final RoomId roomId;

    public RoomClosedException(RoomId roomId) {
        super("Room " + roomId + " is closing");
        this.roomId = roomId;
    }

    public RoomId getRoomId() {
        return roomId;
    }
}
