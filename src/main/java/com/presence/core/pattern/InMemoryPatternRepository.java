package com.presence.core.pattern;

import com.presence.core.model.PatternRecord;
import com.presence.core.model.UserProfile;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local repository. History is lost on restart.
 */
@Repository
public class InMemoryPatternRepository implements PatternRepository {

    private final ConcurrentHashMap<String, List<PatternRecord>> records = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, UserProfile> profiles = new ConcurrentHashMap<>();

    @Override
    public void append(PatternRecord record) {
        List<PatternRecord> list = records.computeIfAbsent(record.userId(), k -> new ArrayList<>());
        synchronized (list) {
            list.add(record);
        }
    }

    @Override
    public List<PatternRecord> history(String userId) {
        List<PatternRecord> list = records.get(userId);
        if (list == null) {
            return List.of();
        }
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    @Override
    public Optional<UserProfile> profile(String userId) {
        return Optional.ofNullable(profiles.get(userId));
    }

    @Override
    public void saveProfile(UserProfile profile) {
        profiles.put(profile.userId(), profile);
    }

    @Override
    public int userCount() {
        return profiles.size();
    }
}
