package com.videoroom.service;

import com.videoroom.model.PeerId;
import com.videoroom.model.RoomId;
import com.videoroom.model.RoomResponse;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Service;

/**
 * 현재 살아 있는 방들의 상태를 조회용 DTO로 만든다.
 */
@Service
public class RoomQueryService {

    private static final long SNAPSHOT_TIMEOUT_MS = 1000;

    private final RoomRegistry roomRegistry;

    public RoomQueryService(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    public List<RoomResponse> listRooms() {
        return roomRegistry.activeRooms().stream()
                .sorted(Comparator.comparing(RoomCoordinator::getCreatedAt).reversed())
                .map(this::toResponse)
                .toList();
    }

    public Optional<RoomResponse> getRoom(String roomId) {
        return roomRegistry.find(RoomId.of(roomId)).map(this::toResponse);
    }

    /**
     * 방을 강제로 닫는다. 해당 방이 없으면 false.
     */
    public boolean closeRoom(String roomId) {
        Optional<RoomCoordinator> coordinator = roomRegistry.find(RoomId.of(roomId));
        coordinator.ifPresent(room -> room.close("room closed by operator"));
        return coordinator.isPresent();
    }

    private RoomResponse toResponse(RoomCoordinator coordinator) {
        // 코디네이터가 바쁘면 빈 목록으로 응답한다.
        Set<PeerId> peers = coordinator.peers()
                .completeOnTimeout(Set.of(), SNAPSHOT_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .join();
        RoomResponse response = new RoomResponse();
        response.setRoomId(coordinator.getId().getValue());
        response.setState(coordinator.getState());
        response.setCreatedAt(coordinator.getCreatedAt());
        response.setPeerCount(peers.size());
        response.setPeers(peers.stream().map(PeerId::getValue).sorted().toList());
        return response;
    }
}
