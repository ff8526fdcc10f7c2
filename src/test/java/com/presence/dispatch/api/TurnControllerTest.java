package com.presence.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.presence.core.engine.CompletedTurn;
import com.presence.core.engine.ConversationTurn;
import com.presence.core.engine.TurnCompletion;
import com.presence.core.engine.TurnEngine;
import com.presence.core.engine.TurnRequest;
import com.presence.core.model.CrisisLevel;
import com.presence.core.model.FocalPoint;
import com.presence.core.model.OverrideStrategy;
import com.presence.core.model.PersonaState;
import com.presence.core.model.ResponseDirective;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TurnController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class TurnControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private TurnEngine turnEngine;

    private static ResponseDirective redDirective() {
        return new ResponseDirective("structured_guide", CrisisLevel.RED, true, OverrideStrategy.OVERRIDE,
                "Your safety matters most right now.", "earth", "guardian", Map.of(), null, null,
                List.of(), false, List.of("crisis_override"), List.of(), List.of());
    }

    private static ResponseDirective greenDirective() {
        return new ResponseDirective("structured_guide", CrisisLevel.GREEN, false, OverrideStrategy.MONITOR,
                null, null, null, Map.of("challengeComfort", 0.1), "curious", "Let's explore together.",
                List.of("onboarding_curious"), false, List.of("crisis_override", "onboarding_tone", "stage_tone"),
                List.of("The shadow side has barely come up lately."), List.of());
    }

    // ── POST /api/v1/turns ───────────────────────────────────────────

    @Test
    @DisplayName("POST /turns returns the directive with snake_case fields")
    void evaluateReturnsDirective() throws Exception {
        when(turnEngine.evaluate(any(TurnRequest.class))).thenReturn(greenDirective());

        String body = objectMapper.writeValueAsString(new TurnRequestBody("u1", "I'm curious", null, null, null));

        mockMvc.perform(post("/api/v1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage_id").value("structured_guide"))
                .andExpect(jsonPath("$.crisis_level").value("GREEN"))
                .andExpect(jsonPath("$.tone_tag").value("curious"))
                .andExpect(jsonPath("$.persona_bias_deltas.challengeComfort").value(0.1))
                .andExpect(jsonPath("$.executed_filters.length()").value(3))
                .andExpect(jsonPath("$.insights[0]").value("The shadow side has barely come up lately."));
    }

    @Test
    @DisplayName("POST /turns passes user, text and stage to the engine")
    void evaluatePassesRequest() throws Exception {
        when(turnEngine.evaluate(any(TurnRequest.class))).thenReturn(greenDirective());

        mockMvc.perform(post("/api/v1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\",\"text\":\"hello\",\"stage_id\":\"transparent_prism\"}"))
                .andExpect(status().isOk());

        var captor = ArgumentCaptor.forClass(TurnRequest.class);
        verify(turnEngine).evaluate(captor.capture());
        assertEquals("u1", captor.getValue().userId());
        assertEquals("hello", captor.getValue().text());
        assertEquals("transparent_prism", captor.getValue().stageId());
        assertNull(captor.getValue().persona());
    }

    @Test
    @DisplayName("POST /turns passes the persona snapshot to the engine")
    void evaluatePassesPersona() throws Exception {
        when(turnEngine.converse(any(TurnRequest.class))).thenReturn(new ConversationTurn(greenDirective(), "ok",
                new CompletedTurn("ok", false, CompletableFuture.completedFuture(null),
                        CompletableFuture.completedFuture(true))));

        mockMvc.perform(post("/api/v1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\",\"text\":\"hello\",\"converse\":true,"
                                + "\"persona\":{\"trust\":0.9,\"challengeComfort\":0.5,\"humorAppreciation\":0.5,"
                                + "\"metaphysicsConfidence\":0.5,\"integration\":0.8}}"))
                .andExpect(status().isOk());

        var captor = ArgumentCaptor.forClass(TurnRequest.class);
        verify(turnEngine).converse(captor.capture());
        assertEquals(new PersonaState(0.9, 0.5, 0.5, 0.5, 0.8), captor.getValue().persona());
    }

    @Test
    @DisplayName("POST /turns with converse returns directive and final text")
    void converse() throws Exception {
        var completed = new CompletedTurn("Your safety matters most right now.", false,
                CompletableFuture.completedFuture(null), CompletableFuture.completedFuture(true));
        when(turnEngine.converse(any(TurnRequest.class)))
                .thenReturn(new ConversationTurn(redDirective(), "Your safety matters most right now.", completed));

        mockMvc.perform(post("/api/v1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\",\"text\":\"hopeless\",\"converse\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.directive.override_active").value(true))
                .andExpect(jsonPath("$.directive.forced_element").value("earth"))
                .andExpect(jsonPath("$.text").value("Your safety matters most right now."))
                .andExpect(jsonPath("$.mastery_applied").value(false));
    }

    @Test
    @DisplayName("POST /turns without user_id returns 400")
    void missingUserId() throws Exception {
        mockMvc.perform(post("/api/v1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hello\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("user_id is required"));

        verify(turnEngine, never()).evaluate(any());
    }

    @Test
    @DisplayName("POST /turns without text returns 400")
    void missingText() throws Exception {
        mockMvc.perform(post("/api/v1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("text is required"));
    }

    // ── POST /api/v1/turns/complete ──────────────────────────────────

    @Test
    @DisplayName("POST /turns/complete returns the post-processed text")
    void complete() throws Exception {
        when(turnEngine.complete(any(TurnCompletion.class))).thenReturn(new CompletedTurn(
                "Your awareness is widening.\n\nLet's sit with that.", true,
                CompletableFuture.completedFuture(null), CompletableFuture.completedFuture(true)));

        mockMvc.perform(post("/api/v1/turns/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\",\"stage_id\":\"transparent_prism\",\"text\":\"hi\","
                                + "\"generated_text\":\"Your consciousness is widening.\",\"focal_point\":\"Shadow\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text").value("Your awareness is widening.\n\nLet's sit with that."))
                .andExpect(jsonPath("$.mastery_applied").value(true));

        var captor = ArgumentCaptor.forClass(TurnCompletion.class);
        verify(turnEngine).complete(captor.capture());
        assertEquals(FocalPoint.SHADOW, captor.getValue().focalPoint());
        assertEquals("transparent_prism", captor.getValue().stageId());
        assertNull(captor.getValue().persona());
    }

    @Test
    @DisplayName("POST /turns/complete passes the persona snapshot to the engine")
    void completePassesPersona() throws Exception {
        when(turnEngine.complete(any(TurnCompletion.class))).thenReturn(new CompletedTurn("ok", true,
                CompletableFuture.completedFuture(null), CompletableFuture.completedFuture(true)));

        mockMvc.perform(post("/api/v1/turns/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\",\"generated_text\":\"ok\","
                                + "\"persona\":{\"trust\":0.8,\"challengeComfort\":0.2,\"humorAppreciation\":0.5,"
                                + "\"metaphysicsConfidence\":0.5,\"integration\":0.7}}"))
                .andExpect(status().isOk());

        var captor = ArgumentCaptor.forClass(TurnCompletion.class);
        verify(turnEngine).complete(captor.capture());
        assertEquals(new PersonaState(0.8, 0.2, 0.5, 0.5, 0.7), captor.getValue().persona());
    }

    @Test
    @DisplayName("POST /turns/complete with an unknown focal point returns 400")
    void invalidFocalPoint() throws Exception {
        mockMvc.perform(post("/api/v1/turns/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\",\"generated_text\":\"ok\",\"focal_point\":\"sideways\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid focal_point: sideways"));

        verify(turnEngine, never()).complete(any());
    }

    @Test
    @DisplayName("POST /turns/complete without generated_text returns 400")
    void missingGeneratedText() throws Exception {
        mockMvc.perform(post("/api/v1/turns/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\",\"text\":\"hi\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("generated_text is required"));
    }
}
