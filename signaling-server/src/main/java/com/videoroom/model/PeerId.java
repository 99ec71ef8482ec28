package com.videoroom.model;

import java.util.Objects;
import java.util.UUID;

/**
 * 방에 참가한 클라이언트 하나를 식별한다. 참가가 성공할 때 한 번만 발급된다.
 */
public final class PeerId {

    private final String value;

    private PeerId(String value) {
        this.value = value;
    }

    /**
     * 128비트 랜덤 UUID로 새 식별자를 만든다.
     */
    public static PeerId random() {
        return new PeerId(UUID.randomUUID().toString());
    }

    public static PeerId of(String value) {
        Objects.requireNonNull(value, "peer id must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("peer id must not be blank");
        }
        return new PeerId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PeerId)) {
            return false;
        }
        return value.equals(((PeerId) other).value);
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
