package com.videoroom.engine;

import com.videoroom.model.EngineCommand;
import com.videoroom.model.EngineEvent;
import com.videoroom.model.PeerId;
import com.videoroom.model.RoomId;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 외부 SFU 없이 동작하는 프로세스 내부 엔진. 한 참가자의 미디어 이벤트를 같은 방의 다른 참가자에게 그대로 돌려준다.
 * 로컬 개발과 테스트용이다.
 */
public class LoopbackMediaEngine extends AbstractMediaEngine {

    private final Set<PeerId> peers = ConcurrentHashMap.newKeySet();

    public LoopbackMediaEngine(RoomId roomId) {
        super(roomId);
    }

    @Override
    protected void dispatch(EngineCommand command) {
        switch (command.getKind()) {
            case ADD_PEER -> {
                peers.add(command.getPeerId());
                publish(EngineEvent.peerJoined(command.getPeerId()));
            }
            case REMOVE_PEER -> {
                if (peers.remove(command.getPeerId())) {
                    publish(EngineEvent.peerLeft(command.getPeerId()));
                }
            }
            case MEDIA_EVENT -> peers.stream()
                    .filter(peer -> !peer.equals(command.getPeerId()))
                    .forEach(peer -> publish(EngineEvent.mediaEventTo(peer, command.getPayload())));
            case SHUTDOWN -> {
                peers.clear();
                publish(EngineEvent.shutdownAck());
            }
        }
    }
}
