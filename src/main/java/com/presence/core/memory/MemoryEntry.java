package com.presence.core.memory;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * One stored memory item.
 *
 * @param kind    entry kind (e.g. "turn")
 * @param payload arbitrary key-value content
 */
public record MemoryEntry(
    String userId,
    String kind,
    Map<String, Object> payload,
    Instant storedAt
) implements Serializable {

    public MemoryEntry {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
