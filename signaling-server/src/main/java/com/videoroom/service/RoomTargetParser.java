package com.videoroom.service;

import com.videoroom.config.SignalingProperties;
import com.videoroom.model.RoomId;
import org.springframework.stereotype.Component;

/**
 * "room:alpha" 형태의 접속 토픽에서 RoomId를 추출한다.
 */
@Component
public class RoomTargetParser {

    private final String prefix;

    public RoomTargetParser(SignalingProperties properties) {
        this.prefix = properties.getRoomTopicPrefix();
    }

    public RoomId parse(String target) {
        if (target == null || target.isBlank()) {
            throw new InvalidRoomTargetException("topic is required");
        }
        if (!target.startsWith(prefix)) {
            throw new InvalidRoomTargetException("topic must start with '" + prefix + "': " + target);
        }
        String roomId = target.substring(prefix.length());
        if (roomId.isBlank()) {
            throw new InvalidRoomTargetException("room id is missing in topic: " + target);
        }
        return RoomId.of(roomId);
    }

    public String getPrefix() {
        return prefix;
    }
}
