package com.presence.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while evaluating or tracking a turn.
 *
 * @param eventType event type (e.g. "turn.evaluated", "crisis.detected", "pattern.tracked")
 * @param userId    the user the event belongs to
 * @param stageId   stage the turn ran under (nullable for tracking-only events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PresenceEvent(
    String eventType,
    String userId,
    String stageId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String TURN_EVALUATED = "turn.evaluated";
    public static final String CRISIS_DETECTED = "crisis.detected";
    public static final String PATTERN_TRACKED = "pattern.tracked";
    public static final String STUCK_POINT = "profile.stuck_point";
    public static final String STORE_WRITE_FAILED = "store.write_failed";

    public static PresenceEvent of(String eventType, String userId, String stageId, Map<String, Object> payload) {
        return new PresenceEvent(eventType, userId, stageId, payload, Instant.now());
    }
}
