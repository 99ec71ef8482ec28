package com.videoroom.websocket;

import java.util.Objects;

/**
 * 참가 요청의 결과. 성공이면 세션 컨텍스트를, 실패면 사유를 가진다.
 */
public final class JoinResult {

    private final SessionContext context;
    private final JoinError error;

    private JoinResult(SessionContext context, JoinError error) {
        this.context = context;
        this.error = error;
    }

    public static JoinResult success(SessionContext context) {
        return new JoinResult(Objects.requireNonNull(context), null);
    }

    public static JoinResult failure(String reason) {
        return new JoinResult(null, new JoinError(reason));
    }

    public boolean isSuccess() {
        return context != null;
    }

    public SessionContext getContext() {
        if (context == null) {
            throw new IllegalStateException("Join failed: " + error.getReason());
        }
        return context;
    }

    public JoinError getError() {
        if (error == null) {
            throw new IllegalStateException("Join succeeded");
        }
        return error;
    }
}
