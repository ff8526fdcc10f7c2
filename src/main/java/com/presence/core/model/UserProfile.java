package com.presence.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Rolling longitudinal profile for a user, upserted after every tracked turn.
 *
 * @param userId           owner
 * @param dominantFocus    most frequent focal point over the profile window
 * @param recurringThemes  keyword to occurrence count over every tracked turn
 * @param trajectory       evolution trajectory over the profile window
 * @param stuckPoints      keyword signatures repeated at least three times in the profile window
 * @param breakthroughs    notes for recent resolved turns, oldest first
 * @param lastUpdated      when the profile was last recomputed
 */
public record UserProfile(
    String userId,
    FocalPoint dominantFocus,
    Map<String, Integer> recurringThemes,
    Trajectory trajectory,
    List<String> stuckPoints,
    List<String> breakthroughs,
    Instant lastUpdated
) implements Serializable {

    public UserProfile {
        recurringThemes = recurringThemes == null ? Map.of() : Map.copyOf(recurringThemes);
        stuckPoints = stuckPoints == null ? List.of() : List.copyOf(stuckPoints);
        breakthroughs = breakthroughs == null ? List.of() : List.copyOf(breakthroughs);
    }

    public static UserProfile empty(String userId) {
        return new UserProfile(userId, null, Map.of(), Trajectory.EXPANDING, List.of(), List.of(), null);
    }
}
