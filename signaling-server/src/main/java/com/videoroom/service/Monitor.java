package com.videoroom.service;

/**
 * 종료 감시 구독을 해제하기 위한 핸들.
 */
@FunctionalInterface
public interface Monitor {

    /**
     * 여러 번 호출해도 안전하다.
     */
    void cancel();
}
