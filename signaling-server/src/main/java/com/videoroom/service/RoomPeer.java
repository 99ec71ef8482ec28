package com.videoroom.service;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 코디네이터가 바라보는 참가자 엔드포인트. 코디네이터는 이 참조를 소유하지 않는다.
 */
public interface RoomPeer {

    /**
     * 이 참가자에게 보낼 엔진 이벤트를 전달한다. 호출자를 막지 않아야 한다.
     */
    void onRoomEvent(JsonNode payload);

    /**
     * 엔드포인트가 어떤 이유로든 종료되면 {@code onTerminated}를 정확히 한 번 호출한다.
     * 이미 종료된 엔드포인트라면 곧바로 호출된다.
     */
    Monitor monitor(Runnable onTerminated);

    /**
     * 방 쪽 사정으로 참가자를 내보낸다. 엔드포인트는 연결을 닫고 종료된다.
     */
    void disconnect(String reason);
}
