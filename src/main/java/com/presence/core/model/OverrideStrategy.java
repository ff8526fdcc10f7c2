package com.presence.core.model;

/**
 * Strategy tag attached to each crisis level in a stage's crisis block.
 */
public enum OverrideStrategy {
    MONITOR,
    GROUNDING,
    OVERRIDE;

    public static OverrideStrategy fromKey(String value) {
        return OverrideStrategy.valueOf(value.trim().toUpperCase());
    }
}
