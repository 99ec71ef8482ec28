package com.videoroom.engine;

import com.videoroom.model.EngineEvent;
import com.videoroom.model.RoomId;

/**
 * 외부에서 들어온 엔진 이벤트를 해당 방의 엔진 바인딩으로 넘긴다.
 */
public interface EngineEventRouter {

    /**
     * @return 해당 방의 엔진이 살아 있어 이벤트를 넘겼으면 true
     */
    boolean route(RoomId roomId, EngineEvent event);
}
