package com.videoroom.engine;

import com.videoroom.model.EngineCommand;
import com.videoroom.model.EngineCommandKind;
import com.videoroom.model.EngineEvent;
import com.videoroom.model.RoomId;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 이벤트 발행과 종료 상태 관리를 공통으로 처리하는 엔진 바인딩의 기반 클래스.
 * 이벤트는 구독자가 생긴 뒤부터 발행 순서대로 전달되며, 구독 전에 발행된 이벤트는 버려진다.
 */
public abstract class AbstractMediaEngine implements MediaEngine {

    private static final Logger log = LoggerFactory.getLogger(AbstractMediaEngine.class);

    private final RoomId roomId;
    // 직접 실행 Executor: 발행한 스레드에서 구독자에게 바로 전달한다.
    private final SubmissionPublisher<EngineEvent> publisher =
            new SubmissionPublisher<>(Runnable::run, Flow.defaultBufferSize());
    private final AtomicBoolean subscribed = new AtomicBoolean();
    private volatile boolean shutdownRequested;
    private volatile boolean closed;

    protected AbstractMediaEngine(RoomId roomId) {
        this.roomId = roomId;
    }

    public RoomId getRoomId() {
        return roomId;
    }

    @Override
    public final void command(EngineCommand command) {
        if (closed) {
            throw new MediaEngineException("Media engine for room " + roomId + " is closed");
        }
        if (shutdownRequested) {
            throw new MediaEngineException("Media engine for room " + roomId + " is shutting down, rejected " + command);
        }
        if (command.getKind() == EngineCommandKind.SHUTDOWN) {
            shutdownRequested = true;
        }
        dispatch(command);
    }

    /**
     * 실제 엔진으로 명령을 전달한다. 호출자를 오래 붙잡지 않아야 한다.
     */
    protected abstract void dispatch(EngineCommand command);

    /**
     * 엔진에서 올라온 이벤트를 구독자에게 전달한다. 닫힌 뒤에는 무시된다.
     */
    public void publish(EngineEvent event) {
        if (closed) {
            log.debug("Dropping {} for closed engine of room {}", event, roomId);
            return;
        }
        try {
            publisher.submit(event);
        } catch (IllegalStateException ex) {
            log.debug("Engine of room {} closed while publishing {}", roomId, event);
        }
    }

    @Override
    public Flow.Publisher<EngineEvent> events() {
        return subscriber -> {
            if (!subscribed.compareAndSet(false, true)) {
                subscriber.onSubscribe(new RejectedSubscription());
                subscriber.onError(new IllegalStateException(
                        "Engine events of room " + roomId + " already have a subscriber"));
                return;
            }
            publisher.subscribe(subscriber);
        };
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        publisher.close();
        onClose();
    }

    /**
     * 바인딩이 가진 로컬 자원을 정리한다.
     */
    protected void onClose() {
    }

    private static class RejectedSubscription implements Flow.Subscription {
        @Override
        public void request(long n) {
        }

        @Override
        public void cancel() {
        }
    }
}
