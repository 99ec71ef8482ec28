package com.videoroom.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 방 조회 API 응답에 사용되는 DTO.
 */
public class RoomResponse {

    private String roomId;
    private RoomState state;
    private int peerCount;
    private Instant createdAt;
    private List<String> peers = new ArrayList<>();

    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }

    public RoomState getState() {
        return state;
    }

    public void setState(RoomState state) {
        this.state = state;
    }

    public int getPeerCount() {
        return peerCount;
    }

    public void setPeerCount(int peerCount) {
        this.peerCount = peerCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public List<String> getPeers() {
        return Collections.unmodifiableList(peers);
    }

    public void setPeers(List<String> peers) {
        this.peers = peers == null ? new ArrayList<>() : new ArrayList<>(peers);
    }
}
