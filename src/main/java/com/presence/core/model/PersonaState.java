package com.presence.core.model;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-user relational parameters, each in the range 0..1.
 */
public record PersonaState(
    double trust,
    double challengeComfort,
    double humorAppreciation,
    double metaphysicsConfidence,
    double integration
) implements Serializable {

    public static final String TRUST = "trust";
    public static final String CHALLENGE_COMFORT = "challengeComfort";
    public static final String HUMOR_APPRECIATION = "humorAppreciation";
    public static final String METAPHYSICS_CONFIDENCE = "metaphysicsConfidence";
    public static final String INTEGRATION = "integration";

    /** Starting point for a user the persona store has never seen. */
    public static PersonaState initial() {
        return new PersonaState(0.3, 0.2, 0.5, 0.5, 0.0);
    }

    /**
     * Returns a copy with the given deltas added and each dimension clamped to 0..1.
     * Unknown dimension names are ignored.
     */
    public PersonaState plus(Map<String, Double> deltas) {
        if (deltas == null || deltas.isEmpty()) {
            return this;
        }
        return new PersonaState(
                clamp(trust + deltas.getOrDefault(TRUST, 0.0)),
                clamp(challengeComfort + deltas.getOrDefault(CHALLENGE_COMFORT, 0.0)),
                clamp(humorAppreciation + deltas.getOrDefault(HUMOR_APPRECIATION, 0.0)),
                clamp(metaphysicsConfidence + deltas.getOrDefault(METAPHYSICS_CONFIDENCE, 0.0)),
                clamp(integration + deltas.getOrDefault(INTEGRATION, 0.0)));
    }

    public static boolean isDimension(String name) {
        return TRUST.equals(name) || CHALLENGE_COMFORT.equals(name) || HUMOR_APPRECIATION.equals(name)
                || METAPHYSICS_CONFIDENCE.equals(name) || INTEGRATION.equals(name);
    }

    public Map<String, Double> asMap() {
        var map = new LinkedHashMap<String, Double>();
        map.put(TRUST, trust);
        map.put(CHALLENGE_COMFORT, challengeComfort);
        map.put(HUMOR_APPRECIATION, humorAppreciation);
        map.put(METAPHYSICS_CONFIDENCE, metaphysicsConfidence);
        map.put(INTEGRATION, integration);
        return map;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
