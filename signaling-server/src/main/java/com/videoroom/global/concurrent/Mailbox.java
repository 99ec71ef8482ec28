package com.videoroom.global.concurrent;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 공용 스레드 풀 위에서 작업을 한 번에 하나씩, 들어온 순서대로 실행하는 직렬 큐.
 * 방 코디네이터와 참가자 엔드포인트는 각자 하나의 Mailbox를 가지며 상태는 그 안에서만 변경된다.
 */
public class Mailbox {

    private static final Logger log = LoggerFactory.getLogger(Mailbox.class);

    private final String name;
    private final Executor executor;
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean();
    private volatile boolean closed;

    public Mailbox(String name, Executor executor) {
        this.name = name;
        this.executor = executor;
    }

    /**
     * 작업을 큐에 넣는다. 이미 닫힌 Mailbox면 false를 반환하고 작업은 버려진다.
     */
    public boolean post(Runnable task) {
        if (closed) {
            log.debug("Mailbox {} is closed, dropping task", name);
            return false;
        }
        queue.add(task);
        schedule();
        return true;
    }

    /**
     * 새 작업을 더 받지 않는다. 이미 큐에 들어간 작업은 끝까지 실행된다.
     */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public String getName() {
        return name;
    }

    private void schedule() {
        if (!scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException ex) {
            scheduled.set(false);
            log.warn("Executor rejected mailbox {}, {} task(s) left unprocessed", name, queue.size());
        }
    }

    private void drain() {
        try {
            Runnable task;
            while ((task = queue.poll()) != null) {
                try {
                    task.run();
                } catch (RuntimeException ex) {
                    // 작업 하나의 실패가 Mailbox 전체를 멈추게 해서는 안 된다.
                    log.error("Task failed in mailbox {}", name, ex);
                }
            }
        } finally {
            scheduled.set(false);
            if (!queue.isEmpty()) {
                schedule();
            }
        }
    }
}
