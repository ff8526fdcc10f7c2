package com.presence.core.pattern;

import com.presence.core.events.EventBus;
import com.presence.core.events.PresenceEvent;
import com.presence.core.metrics.PresenceMetrics;
import com.presence.core.model.FocalPoint;
import com.presence.core.model.PatternRecord;
import com.presence.core.model.ProfileSummary;
import com.presence.core.model.RelatedPattern;
import com.presence.core.model.ResponseDirective;
import com.presence.core.model.Resolution;
import com.presence.core.model.TrackingResult;
import com.presence.core.model.Trajectory;
import com.presence.core.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Longitudinal per-user tracking: appends one {@link PatternRecord} per turn and recomputes the
 * user's {@link UserProfile} from the sliding profile window.
 * <p>
 * Writes for the same user are serialized with a per-user lock; different users never contend.
 * {@link #summary(String)} takes the same lock for a consistent snapshot but never writes.
 */
@Service
public class PatternTracker {

    private static final Logger log = LoggerFactory.getLogger(PatternTracker.class);

    private final PatternRepository repository;
    private final FocalPointDetector focalPointDetector;
    private final TrackingProperties properties;
    private final EventBus eventBus;
    private final PresenceMetrics metrics;
    private final Clock clock;
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public PatternTracker(PatternRepository repository, FocalPointDetector focalPointDetector,
                          TrackingProperties properties, EventBus eventBus, PresenceMetrics metrics) {
        this(repository, focalPointDetector, properties, eventBus, metrics, Clock.systemUTC());
    }

    PatternTracker(PatternRepository repository, FocalPointDetector focalPointDetector,
                   TrackingProperties properties, EventBus eventBus, PresenceMetrics metrics, Clock clock) {
        this.repository = repository;
        this.focalPointDetector = focalPointDetector;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Records one turn and upserts the user's profile. Never throws for malformed text.
     *
     * @param focalPoint the lens the turn addressed; detected from the input when null
     * @param element    optional element tag
     */
    public TrackingResult track(String userId, String inputText, FocalPoint focalPoint, String element,
                                String generatedResponse) {
        String text = inputText != null ? inputText : "";
        FocalPoint focus = focalPoint != null ? focalPoint : focalPointDetector.detect(text);

        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            List<PatternRecord> history = repository.history(userId);
            List<String> keywords = KeywordExtractor.extract(text);
            double confidence = PatternAnalysis.confidence(text, properties.markersFor(focus));

            List<RelatedPattern> related = PatternAnalysis.relatedPatterns(keywords,
                    PatternAnalysis.window(history, properties.getRelatedWindow()), properties.getMaxRelated());

            Instant now = clock.instant();
            var draft = new PatternRecord(userId, now, focus, element, confidence, keywords, null);
            Resolution resolution = PatternAnalysis.resolution(draft.signature(),
                    PatternAnalysis.window(history, properties.getProfileWindow()),
                    text, generatedResponse, !related.isEmpty());
            var record = new PatternRecord(userId, now, focus, element, confidence, keywords, resolution);
            repository.append(record);

            var updated = new ArrayList<PatternRecord>(history);
            updated.add(record);
            UserProfile previous = repository.profile(userId).orElseGet(() -> UserProfile.empty(userId));
            UserProfile profile = recomputeProfile(previous, updated, record, now);
            repository.saveProfile(profile);

            metrics.recordPatternConfidence(confidence);
            log.debug("Tracked {} record for user {} (confidence {}, resolution {}, trajectory {})",
                    focus.key(), userId, confidence, resolution, profile.trajectory());
            eventBus.publish(PresenceEvent.of(PresenceEvent.PATTERN_TRACKED, userId, null, Map.of(
                    "focalPoint", focus.key(),
                    "confidence", confidence,
                    "resolution", resolution.name().toLowerCase(),
                    "trajectory", profile.trajectory().name().toLowerCase())));
            for (String stuck : profile.stuckPoints()) {
                if (!previous.stuckPoints().contains(stuck)) {
                    eventBus.publish(PresenceEvent.of(PresenceEvent.STUCK_POINT, userId, null,
                            Map.of("signature", stuck)));
                }
            }
            return new TrackingResult(record, related, profile);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current profile plus derived insights and recommendations. Has no side effects.
     */
    public ProfileSummary summary(String userId) {
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            List<PatternRecord> history = repository.history(userId);
            UserProfile profile = repository.profile(userId).orElseGet(() -> UserProfile.empty(userId));
            List<String> insights = PatternAnalysis.insights(history, profile.stuckPoints(), profile.trajectory(),
                    properties.getRelatedWindow(), properties.getRecentWindow(), ResponseDirective.MAX_INSIGHTS);

            var recommendations = new ArrayList<String>();
            PatternAnalysis.approachShift(history, properties.getRecentWindow()).ifPresent(recommendations::add);
            if (!profile.stuckPoints().isEmpty()) {
                recommendations.add(PatternAnalysis.stuckPointRecommendation(profile.stuckPoints().get(0)));
            }
            List<String> capped = recommendations.size() > ResponseDirective.MAX_RECOMMENDATIONS
                    ? recommendations.subList(0, ResponseDirective.MAX_RECOMMENDATIONS)
                    : recommendations;
            return new ProfileSummary(profile, history.size(), List.copyOf(insights), List.copyOf(capped));
        } finally {
            lock.unlock();
        }
    }

    public List<PatternRecord> history(String userId) {
        return repository.history(userId);
    }

    private UserProfile recomputeProfile(UserProfile previous, List<PatternRecord> history, PatternRecord latest,
                                         Instant now) {
        List<PatternRecord> window = PatternAnalysis.window(history, properties.getProfileWindow());

        Map<String, Integer> themes = new HashMap<>(previous.recurringThemes());
        for (String keyword : latest.keywords()) {
            themes.merge(keyword, 1, Integer::sum);
        }

        List<String> breakthroughs = new ArrayList<>(previous.breakthroughs());
        if (latest.resolution() == Resolution.RESOLVED) {
            breakthroughs.add(latest.focalPoint().key() + "/" + (latest.element() != null ? latest.element() : "-")
                    + ": " + String.join(" ", latest.keywords()));
            while (breakthroughs.size() > properties.getBreakthroughLimit()) {
                breakthroughs.remove(0);
            }
        }

        Trajectory trajectory = PatternAnalysis.trajectory(history.size(), window, properties.getProfileWindow());
        return new UserProfile(
                latest.userId(),
                PatternAnalysis.dominantFocus(window),
                themes,
                trajectory,
                PatternAnalysis.stuckPoints(window),
                breakthroughs,
                now);
    }

    private ReentrantLock lockFor(String userId) {
        return locks.computeIfAbsent(userId, k -> new ReentrantLock());
    }
}
