package com.videoroom.engine;

import com.videoroom.model.EngineCommand;
import com.videoroom.model.EngineEvent;
import java.util.concurrent.Flow;

/**
 * 방 하나에 묶인 미디어 릴레이(SFU) 엔진과의 연결.
 * 명령은 단방향으로 보내고, 결과는 {@link #events()} 스트림으로 비동기로 돌아온다.
 */
public interface MediaEngine extends AutoCloseable {

    /**
     * 명령을 전달한다. 바인딩이 명령을 즉시 거부하면 {@link MediaEngineException}을 던진다.
     */
    void command(EngineCommand command);

    /**
     * 엔진 이벤트 스트림. 구독자는 하나만 허용되며 다시 구독할 수 없다.
     */
    Flow.Publisher<EngineEvent> events();

    @Override
    void close();
}
