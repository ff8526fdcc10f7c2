package com.presence.core.engine;

import com.presence.core.model.ResponseDirective;

/**
 * A full evaluate, generate, complete round trip.
 */
public record ConversationTurn(
    ResponseDirective directive,
    String generatedText,
    CompletedTurn completed
) {}
