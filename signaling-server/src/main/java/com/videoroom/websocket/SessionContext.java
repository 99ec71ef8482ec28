package com.videoroom.websocket;

import com.videoroom.model.PeerId;
import com.videoroom.model.RoomId;
import com.videoroom.service.RoomCoordinator;

/**
 * 참가가 성공한 엔드포인트가 어느 방에 어떤 ID로 묶여 있는지를 담는다.
 */
public class SessionContext {

    private final RoomId roomId;
    private final RoomCoordinator room;
    private final PeerId peerId;

    public SessionContext(RoomId roomId, RoomCoordinator room, PeerId peerId) {
        this.roomId = roomId;
        this.room = room;
        this.peerId = peerId;
    }

    public RoomId getRoomId() {
        return roomId;
    }

    public RoomCoordinator getRoom() {
        return room;
    }

    public PeerId getPeerId() {
        return peerId;
    }
}
