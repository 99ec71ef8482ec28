package com.videoroom.engine;

import com.videoroom.model.RoomId;

/**
 * 방마다 새 엔진 인스턴스를 만들어 시작한다.
 */
public interface MediaEngineFactory {

    /**
     * @throws MediaEngineException 엔진을 시작할 수 없을 때
     */
    MediaEngine start(RoomId roomId);
}
