package com.videoroom.model;

/**
 * 방 코디네이터의 생명주기 단계.
 */
public enum RoomState {
    STARTING,
    ACTIVE,
    TERMINATING,
    TERMINATED;

    public boolean acceptsPeers() {
        return this == ACTIVE;
    }
}
