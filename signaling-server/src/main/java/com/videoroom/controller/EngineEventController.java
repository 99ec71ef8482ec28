package com.videoroom.controller;

import com.videoroom.engine.EngineEventRouter;
import com.videoroom.model.EngineEventRequest;
import com.videoroom.model.RoomId;
import jakarta.validation.Valid;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * SFU 서버가 방별 엔진 이벤트를 밀어 넣는 내부 API.
 */
@RestController
@RequestMapping("/internal/rooms/{roomId}/engine-events")
@ConditionalOnProperty(prefix = "signaling.engine", name = "type", havingValue = "rest", matchIfMissing = true)
public class EngineEventController {

    private final EngineEventRouter engineEventRouter;

    public EngineEventController(EngineEventRouter engineEventRouter) {
        this.engineEventRouter = engineEventRouter;
    }

    @PostMapping
    public ResponseEntity<Void> publish(@PathVariable String roomId, @Valid @RequestBody EngineEventRequest request) {
        if (!engineEventRouter.route(RoomId.of(roomId), request.toEngineEvent())) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().build();
    }
}
