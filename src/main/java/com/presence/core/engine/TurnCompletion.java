package com.presence.core.engine;

import com.presence.core.model.FocalPoint;
import com.presence.core.model.PersonaState;

/**
 * Generated text for a turn, handed back for post-processing and tracking.
 *
 * @param text          the user's original input
 * @param generatedText text returned by the generation collaborator
 * @param focalPoint    lens the turn addressed; detected from the input when null
 * @param element       optional element tag
 * @param persona       persona snapshot the turn was evaluated with; the persona store is consulted when null
 */
public record TurnCompletion(
    String userId,
    String stageId,
    String text,
    String generatedText,
    FocalPoint focalPoint,
    String element,
    PersonaState persona
) {
    public TurnCompletion(String userId, String stageId, String text, String generatedText,
                          FocalPoint focalPoint, String element) {
        this(userId, stageId, text, generatedText, focalPoint, element, null);
    }
}
