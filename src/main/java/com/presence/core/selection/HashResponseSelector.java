package com.presence.core.selection;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.zip.CRC32;

/**
 * Stateless selection: CRC32 of {@code seed:key}, modulo the number of options.
 * The same key always yields the same option.
 */
public class HashResponseSelector implements ResponseSelector {

    private final long seed;

    public HashResponseSelector(long seed) {
        this.seed = seed;
    }

    @Override
    public Optional<String> select(List<String> options, String key) {
        if (options == null || options.isEmpty()) {
            return Optional.empty();
        }
        var crc = new CRC32();
        crc.update((seed + ":" + (key != null ? key : "")).getBytes(StandardCharsets.UTF_8));
        int index = (int) (crc.getValue() % options.size());
        return Optional.of(options.get(index));
    }
}
