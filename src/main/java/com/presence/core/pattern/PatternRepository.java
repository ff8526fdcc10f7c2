package com.presence.core.pattern;

import com.presence.core.model.PatternRecord;
import com.presence.core.model.UserProfile;

import java.util.List;
import java.util.Optional;

/**
 * Per-user storage for pattern records and profiles.
 * <p>
 * Implementations need not be safe for concurrent writes to the same user;
 * {@link PatternTracker} serializes those.
 */
public interface PatternRepository {

    void append(PatternRecord record);

    /** All records for the user, oldest first. Empty for unknown users. */
    List<PatternRecord> history(String userId);

    Optional<UserProfile> profile(String userId);

    void saveProfile(UserProfile profile);

    int userCount();
}
