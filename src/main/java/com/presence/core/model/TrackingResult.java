package com.presence.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of tracking one turn. Related patterns are derived here and not persisted.
 */
public record TrackingResult(
    PatternRecord record,
    List<RelatedPattern> relatedPatterns,
    UserProfile profile
) implements Serializable {}
