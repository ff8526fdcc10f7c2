package com.presence.core.filter;

import com.presence.core.model.CrisisLevel;
import com.presence.core.model.PersonaState;
import com.presence.core.stage.StageConfig;

/**
 * Per-turn input shared by every filter in a pipeline run.
 *
 * @param userId      the user the turn belongs to
 * @param text        raw user text, never null
 * @param stage       resolved stage configuration
 * @param crisisLevel crisis level computed before the stage was looked up
 * @param persona     persona snapshot for the user
 */
public record FilterContext(
    String userId,
    String text,
    StageConfig stage,
    CrisisLevel crisisLevel,
    PersonaState persona
) {
    public FilterContext {
        text = text == null ? "" : text;
    }
}
