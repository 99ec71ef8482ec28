package com.videoroom.controller;

import com.videoroom.model.RoomResponse;
import com.videoroom.service.RoomQueryService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rooms")
public class RoomController {

    private final RoomQueryService roomQueryService;

    public RoomController(RoomQueryService roomQueryService) {
        this.roomQueryService = roomQueryService;
    }

    @GetMapping
    public ResponseEntity<List<RoomResponse>> listRooms() {
        return ResponseEntity.ok(roomQueryService.listRooms());
    }

    @GetMapping("/{roomId}")
    public ResponseEntity<RoomResponse> getRoom(@PathVariable String roomId) {
        return roomQueryService.getRoom(roomId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{roomId}")
    public ResponseEntity<Void> closeRoom(@PathVariable String roomId) {
        if (!roomQueryService.closeRoom(roomId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().build();
    }
}
