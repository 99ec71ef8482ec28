package com.videoroom.controller;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.videoroom.engine.EngineEventRouter;
import com.videoroom.global.error.GlobalExceptionHandler;
import com.videoroom.model.EngineCommandKind;
import com.videoroom.model.EngineEvent;
import com.videoroom.model.EngineEventKind;
import com.videoroom.model.PeerId;
import com.videoroom.model.RoomId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * SFU → 시그널링 서버 내부 이벤트 API (standalone MockMvc)
 */
class EngineEventControllerTest {

    private EngineEventRouter router;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        router = mock(EngineEventRouter.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new EngineEventController(router))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter())
                .build();
    }

    private EngineEvent routedEvent(String roomId) {
        ArgumentCaptor<EngineEvent> captor = ArgumentCaptor.forClass(EngineEvent.class);
        verify(router).route(eq(RoomId.of(roomId)), captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("targeted media event is routed to the room's engine")
    void mediaEvent_forPeer() throws Exception {
        when(router.route(any(), any())).thenReturn(true);

        mockMvc.perform(post("/internal/rooms/{roomId}/engine-events", "alpha")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"media_event\",\"target\":\"p1\",\"data\":{\"type\":\"sdpAnswer\"}}"))
                .andExpect(status().isAccepted());

        EngineEvent event = routedEvent("alpha");
        assertEquals(EngineEventKind.MEDIA_EVENT, event.getKind());
        assertEquals(PeerId.of("p1"), event.getTarget());
        assertFalse(event.isBroadcast());
        assertEquals("sdpAnswer", event.getPayload().path("type").asText());
    }

    @Test
    void mediaEvent_broadcast() throws Exception {
        when(router.route(any(), any())).thenReturn(true);

        mockMvc.perform(post("/internal/rooms/{roomId}/engine-events", "alpha")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"MEDIA_EVENT\",\"broadcast\":true,\"data\":{\"type\":\"tracksAdded\"}}"))
                .andExpect(status().isAccepted());

        assertTrue(routedEvent("alpha").isBroadcast());
    }

    @Test
    void commandRejected_carriesCommandAndReason() throws Exception {
        when(router.route(any(), any())).thenReturn(true);

        mockMvc.perform(post("/internal/rooms/{roomId}/engine-events", "alpha")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"command_rejected\",\"command\":\"ADD_PEER\",\"target\":\"p1\",\"reason\":\"full\"}"))
                .andExpect(status().isAccepted());

        EngineEvent event = routedEvent("alpha");
        assertEquals(EngineCommandKind.ADD_PEER, event.getRejectedCommand());
        assertEquals("full", event.getReason());
    }

    @Test
    @DisplayName("returns 404 when the room has no live engine")
    void unknownRoom() throws Exception {
        when(router.route(any(), any())).thenReturn(false);

        mockMvc.perform(post("/internal/rooms/{roomId}/engine-events", "ghost")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"shutdown_ack\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("targeted media event without target is a bad request")
    void missingTarget() throws Exception {
        mockMvc.perform(post("/internal/rooms/{roomId}/engine-events", "alpha")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"media_event\",\"data\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(router);
    }

    @Test
    void missingKind() throws Exception {
        mockMvc.perform(post("/internal/rooms/{roomId}/engine-events", "alpha")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\":\"p1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("kind")));

        verifyNoInteractions(router);
    }

    @Test
    @DisplayName("unknown event kind is a bad request with an error body")
    void unknownKind() throws Exception {
        mockMvc.perform(post("/internal/rooms/{roomId}/engine-events", "alpha")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"exploded\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("Malformed request body")));

        verifyNoInteractions(router);
    }
}
