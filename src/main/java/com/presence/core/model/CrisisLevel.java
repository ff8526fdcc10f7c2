package com.presence.core.model;

/**
 * Safety classification of a raw user message.
 */
public enum CrisisLevel {
    GREEN,
    YELLOW,
    RED;

    /** Configuration key for this level (e.g. "red"). */
    public String key() {
        return name().toLowerCase();
    }
}
