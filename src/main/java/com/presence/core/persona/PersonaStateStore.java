package com.presence.core.persona;

import com.presence.core.model.PersonaState;

import java.util.Map;

/**
 * Read/write access to per-user persona parameters.
 */
public interface PersonaStateStore {

    /** Current state, or {@link PersonaState#initial()} for a user never seen before. */
    PersonaState get(String userId);

    /**
     * Adds the deltas to the user's state, clamping each dimension to 0..1.
     *
     * @return the updated state
     */
    PersonaState applyDeltas(String userId, Map<String, Double> deltas);

    void put(String userId, PersonaState state);
}
