package com.presence.core.selection;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cycles through the options per key, starting at the seed offset.
 */
public class RoundRobinResponseSelector implements ResponseSelector {

    private final long seed;
    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public RoundRobinResponseSelector(long seed) {
        this.seed = seed;
    }

    @Override
    public Optional<String> select(List<String> options, String key) {
        if (options == null || options.isEmpty()) {
            return Optional.empty();
        }
        long next = counters.computeIfAbsent(key != null ? key : "", k -> new AtomicLong(seed))
                .getAndIncrement();
        return Optional.of(options.get((int) Math.floorMod(next, (long) options.size())));
    }
}
