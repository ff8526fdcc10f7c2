package com.presence.core.persona;

import com.presence.core.model.PersonaState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryPersonaStateStore implements PersonaStateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPersonaStateStore.class);

    private final ConcurrentHashMap<String, PersonaState> states = new ConcurrentHashMap<>();

    @Override
    public PersonaState get(String userId) {
        return states.getOrDefault(userId, PersonaState.initial());
    }

    @Override
    public PersonaState applyDeltas(String userId, Map<String, Double> deltas) {
        if (deltas == null || deltas.isEmpty()) {
            return get(userId);
        }
        deltas.keySet().stream()
                .filter(name -> !PersonaState.isDimension(name))
                .forEach(name -> log.debug("Ignoring unknown persona dimension '{}' for user {}", name, userId));
        return states.compute(userId, (id, current) ->
                (current != null ? current : PersonaState.initial()).plus(deltas));
    }

    @Override
    public void put(String userId, PersonaState state) {
        states.put(userId, state);
    }
}
