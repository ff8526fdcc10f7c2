package com.presence.core.selection;

import java.util.List;
import java.util.Optional;

/**
 * Chooses one entry among several canned options (responses, closing lines, paradox lines).
 * Implementations must be deterministic for a given configuration and call sequence.
 */
public interface ResponseSelector {

    /**
     * @param options candidate lines, in declared order
     * @param key     caller-supplied selection key (e.g. user id plus context)
     * @return the chosen option, or empty when there are no options
     */
    Optional<String> select(List<String> options, String key);
}
