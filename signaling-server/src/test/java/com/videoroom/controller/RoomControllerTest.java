package com.videoroom.controller;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.videoroom.model.RoomResponse;
import com.videoroom.model.RoomState;
import com.videoroom.service.RoomQueryService;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * 방 조회/종료 API (standalone MockMvc)
 */
class RoomControllerTest {

    private RoomQueryService roomQueryService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        roomQueryService = mock(RoomQueryService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new RoomController(roomQueryService))
                .setMessageConverters(new MappingJackson2HttpMessageConverter())
                .build();
    }

    private RoomResponse room(String id, String... peers) {
        RoomResponse response = new RoomResponse();
        response.setRoomId(id);
        response.setState(RoomState.ACTIVE);
        response.setCreatedAt(Instant.parse("2024-05-01T10:00:00Z"));
        response.setPeerCount(peers.length);
        response.setPeers(List.of(peers));
        return response;
    }

    @Test
    @DisplayName("GET /api/rooms lists live rooms")
    void listRooms() throws Exception {
        when(roomQueryService.listRooms()).thenReturn(List.of(room("alpha", "p1", "p2"), room("beta")));

        mockMvc.perform(get("/api/rooms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].roomId", is("alpha")))
                .andExpect(jsonPath("$[0].peerCount", is(2)))
                .andExpect(jsonPath("$[0].peers", contains("p1", "p2")))
                .andExpect(jsonPath("$[1].state", is("ACTIVE")));
    }

    @Test
    @DisplayName("GET /api/rooms/{roomId} returns 404 for unknown room")
    void getRoom_unknown() throws Exception {
        when(roomQueryService.getRoom("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/rooms/{roomId}", "nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getRoom_found() throws Exception {
        when(roomQueryService.getRoom("alpha")).thenReturn(Optional.of(room("alpha", "p1")));

        mockMvc.perform(get("/api/rooms/{roomId}", "alpha"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roomId", is("alpha")))
                .andExpect(jsonPath("$.peers", contains("p1")));
    }

    @Test
    @DisplayName("DELETE /api/rooms/{roomId} closes a live room")
    void closeRoom() throws Exception {
        when(roomQueryService.closeRoom("alpha")).thenReturn(true);
        when(roomQueryService.closeRoom("nope")).thenReturn(false);

        mockMvc.perform(delete("/api/rooms/{roomId}", "alpha"))
                .andExpect(status().isAccepted());
        mockMvc.perform(delete("/api/rooms/{roomId}", "nope"))
                .andExpect(status().isNotFound());

        verify(roomQueryService).closeRoom("alpha");
        verify(roomQueryService).closeRoom("nope");
    }
}
