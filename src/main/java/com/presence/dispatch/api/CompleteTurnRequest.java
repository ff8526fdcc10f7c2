package com.presence.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.presence.core.model.PersonaState;

/**
 * Inbound JSON body for POST /api/v1/turns/complete.
 *
 * @param generatedText text produced by the generation collaborator
 * @param focalPoint    ideal, shadow, resources or outcome; nullable, detected from the input when absent
 * @param element       optional element tag
 * @param persona       persona snapshot the turn was evaluated with; the stored persona is used when absent
 */
public record CompleteTurnRequest(
    @JsonProperty("user_id") String userId,
    @JsonProperty("stage_id") String stageId,
    String text,
    @JsonProperty("generated_text") String generatedText,
    @JsonProperty("focal_point") String focalPoint,
    String element,
    PersonaState persona
) {}
