package com.presence.core.model;

/**
 * The four reflective lenses a turn can address.
 * Declaration order is the cyclic rotation order used for approach-shift suggestions
 * and the tie-break order for focal point detection.
 */
public enum FocalPoint {
    IDEAL,
    SHADOW,
    RESOURCES,
    OUTCOME;

    public FocalPoint next() {
        FocalPoint[] all = values();
        return all[(ordinal() + 1) % all.length];
    }

    public String key() {
        return name().toLowerCase();
    }

    /**
     * Parses a focal point name case-insensitively.
     *
     * @return the focal point, or {@code null} when the value is blank or unknown
     */
    public static FocalPoint fromKey(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (FocalPoint fp : values()) {
            if (fp.name().equalsIgnoreCase(value.trim())) {
                return fp;
            }
        }
        return null;
    }
}
