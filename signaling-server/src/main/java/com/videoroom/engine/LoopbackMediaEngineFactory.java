package com.videoroom.engine;

import com.videoroom.model.RoomId;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "signaling.engine", name = "type", havingValue = "loopback")
public class LoopbackMediaEngineFactory implements MediaEngineFactory {

    @Override
    public MediaEngine start(RoomId roomId) {
        return new LoopbackMediaEngine(roomId);
    }
}
