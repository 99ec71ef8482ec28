package com.videoroom.websocket;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;

/**
 * 참가자 한 명과의 양방향 연결. 프레임 형식과 전송 방식은 구현체가 정한다.
 */
public interface PeerTransport {

    String getId();

    void send(ObjectNode frame) throws IOException;

    boolean isOpen();

    void close(String reason);
}
