package com.presence.core.engine;

import com.presence.core.model.PersonaState;

/**
 * Input for evaluating one turn.
 *
 * @param persona optional persona snapshot; the persona store is consulted when null
 */
public record TurnRequest(
    String userId,
    String text,
    String stageId,
    PersonaState persona
) {
    public TurnRequest(String userId, String text, String stageId) {
        this(userId, text, stageId, null);
    }
}
