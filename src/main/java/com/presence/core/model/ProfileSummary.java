package com.presence.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Read-only view of a user's profile together with the guidance derived from it.
 */
public record ProfileSummary(
    UserProfile profile,
    int recordCount,
    List<String> insights,
    List<String> recommendations
) implements Serializable {}
