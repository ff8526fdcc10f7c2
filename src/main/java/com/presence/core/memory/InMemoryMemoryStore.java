package com.presence.core.memory;

import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local memory store keeping the most recent entries per user.
 */
@Repository
public class InMemoryMemoryStore implements MemoryStore {

    static final int MAX_ENTRIES_PER_USER = 500;

    private final ConcurrentHashMap<String, Deque<MemoryEntry>> entries = new ConcurrentHashMap<>();

    @Override
    public void store(String userId, String kind, Map<String, Object> payload) {
        if (userId == null || kind == null) {
            throw new MemoryStoreException("userId and kind are required");
        }
        Deque<MemoryEntry> deque = entries.computeIfAbsent(userId, k -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(new MemoryEntry(userId, kind, payload, Instant.now()));
            while (deque.size() > MAX_ENTRIES_PER_USER) {
                deque.removeFirst();
            }
        }
    }

    @Override
    public List<MemoryEntry> query(String userId, MemoryQuery criteria) {
        Deque<MemoryEntry> deque = entries.get(userId);
        if (deque == null) {
            return List.of();
        }
        MemoryQuery query = criteria != null ? criteria : MemoryQuery.all();
        List<MemoryEntry> matching;
        synchronized (deque) {
            matching = deque.stream()
                    .filter(e -> query.kind() == null || query.kind().equals(e.kind()))
                    .toList();
        }
        int limit = Math.max(0, query.limit());
        return matching.size() <= limit ? matching : matching.subList(matching.size() - limit, matching.size());
    }
}
