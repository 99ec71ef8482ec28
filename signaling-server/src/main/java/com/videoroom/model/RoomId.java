package com.videoroom.model;

import java.util.Objects;

/**
 * 방 하나를 식별하는 불변 값. 접속 토픽에서 접두어를 제거한 나머지 문자열이다.
 */
public final class RoomId {

    private final String value;

    private RoomId(String value) {
        this.value = value;
    }

    public static RoomId of(String value) {
        Objects.requireNonNull(value, "room id must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("room id must not be blank");
        }
        return new RoomId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RoomId)) {
            return false;
        }
        return value.equals(((RoomId) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
