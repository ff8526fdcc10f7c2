package com.presence.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.presence.core.model.PersonaState;

/**
 * Inbound JSON body for POST /api/v1/turns.
 *
 * @param userId  user the turn belongs to
 * @param text    raw user message
 * @param stageId relationship stage; nullable, falls back to the default stage
 * @param converse when true, also generates and completes the turn with the configured generator
 * @param persona optional persona snapshot; the stored persona is used when absent
 */
public record TurnRequestBody(
    @JsonProperty("user_id") String userId,
    String text,
    @JsonProperty("stage_id") String stageId,
    Boolean converse,
    PersonaState persona
) {}
