package com.presence.core.memory;

import java.util.List;
import java.util.Map;

/**
 * Best-effort, eventually consistent memory store.
 * Implementations signal failures with {@link MemoryStoreException}.
 */
public interface MemoryStore {

    void store(String userId, String kind, Map<String, Object> payload);

    /**
     * @param criteria optional filter; {@code kind} restricts by entry kind and {@code limit} caps
     *                 the result to the most recent entries
     * @return matching entries, oldest first
     */
    List<MemoryEntry> query(String userId, MemoryQuery criteria);

    record MemoryQuery(String kind, int limit) {

        public static MemoryQuery all() {
            return new MemoryQuery(null, Integer.MAX_VALUE);
        }

        public static MemoryQuery ofKind(String kind, int limit) {
            return new MemoryQuery(kind, limit);
        }
    }
}
