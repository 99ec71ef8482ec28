package com.videoroom.websocket;

public class JoinError {

    private final String reason;

    public JoinError(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "JoinError{" + reason + "}";
    }
}
