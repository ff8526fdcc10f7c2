package com.presence.core.pattern;

import com.presence.core.events.EventBus;
import com.presence.core.events.PresenceEvent;
import com.presence.core.metrics.PresenceMetrics;
import com.presence.core.model.FocalPoint;
import com.presence.core.model.Resolution;
import com.presence.core.model.Trajectory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PatternTrackerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryPatternRepository repository;
    private SimpleMeterRegistry meterRegistry;
    private EventBus eventBus;
    private List<PresenceEvent> events;
    private PatternTracker tracker;

    @BeforeEach
    void setUp() {
        var properties = new TrackingProperties();
        repository = new InMemoryPatternRepository();
        meterRegistry = new SimpleMeterRegistry();
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
        tracker = new PatternTracker(repository, new FocalPointDetector(properties), properties, eventBus,
                new PresenceMetrics(meterRegistry), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("track")
    class Track {

        @Test
        @DisplayName("detects the focal point and records keywords and confidence")
        void recordsTurn() {
            var result = tracker.track("u1", "I fear I will avoid the hard talk", null, "water", "reply");

            assertEquals(FocalPoint.SHADOW, result.record().focalPoint());
            assertEquals(0.7, result.record().confidence(), 1e-9);
            assertEquals(List.of("fear", "avoid", "hard", "talk"), result.record().keywords());
            assertEquals("water", result.record().element());
            assertEquals(NOW, result.record().timestamp());
            assertEquals(Resolution.EVOLVING, result.record().resolution());
            assertEquals(1, repository.history("u1").size());
        }

        @Test
        @DisplayName("explicit focal point is used as given")
        void explicitFocalPoint() {
            var result = tracker.track("u1", "I fear the dark", FocalPoint.OUTCOME, null, null);
            assertEquals(FocalPoint.OUTCOME, result.record().focalPoint());
            assertEquals(0.5, result.record().confidence(), 1e-9);
        }

        @Test
        @DisplayName("profile is upserted with themes, focus and timestamp")
        void upsertsProfile() {
            tracker.track("u1", "career money worries", FocalPoint.SHADOW, null, null);
            var result = tracker.track("u1", "career growth", FocalPoint.IDEAL, null, null);

            var profile = result.profile();
            assertEquals(profile, repository.profile("u1").orElseThrow());
            assertEquals(2, profile.recurringThemes().get("career"));
            assertEquals(1, profile.recurringThemes().get("growth"));
            assertEquals(FocalPoint.SHADOW, profile.dominantFocus());
            assertEquals(Trajectory.EXPANDING, profile.trajectory());
            assertEquals(NOW, profile.lastUpdated());
        }

        @Test
        @DisplayName("earlier turn sharing two keywords makes the turn recurring")
        void relatedTurn() {
            tracker.track("u1", "career money worries", FocalPoint.SHADOW, "fire", null);
            var result = tracker.track("u1", "money and career again", FocalPoint.OUTCOME, null, null);

            assertEquals(1, result.relatedPatterns().size());
            assertEquals(FocalPoint.SHADOW, result.relatedPatterns().get(0).focalPoint());
            assertEquals(Resolution.RECURRING, result.record().resolution());
        }

        @Test
        @DisplayName("third identical keyword set is stuck and raises a stuck point event once")
        void stuckPoint() {
            tracker.track("u1", "career money worries", FocalPoint.SHADOW, null, null);
            tracker.track("u1", "worries about money, career", FocalPoint.SHADOW, null, null);
            var third = tracker.track("u1", "career, money, worries", FocalPoint.SHADOW, null, null);
            tracker.track("u1", "career money worries", FocalPoint.SHADOW, null, null);

            assertEquals(Resolution.STUCK, third.record().resolution());
            assertEquals(List.of("career,money,worries"), third.profile().stuckPoints());
            long stuckEvents = events.stream().filter(e -> PresenceEvent.STUCK_POINT.equals(e.eventType())).count();
            assertEquals(1, stuckEvents);
        }

        @Test
        @DisplayName("resolved turn is noted as a breakthrough")
        void breakthrough() {
            var result = tracker.track("u1", "I realize my career matters", null, null, null);

            assertEquals(Resolution.RESOLVED, result.record().resolution());
            assertEquals(List.of("ideal/-: realize career matters"), result.profile().breakthroughs());
        }

        @Test
        @DisplayName("publishes a tracked event and records confidence")
        void eventsAndMetrics() {
            tracker.track("u1", "hope and purpose", null, null, null);

            var tracked = events.stream().filter(e -> PresenceEvent.PATTERN_TRACKED.equals(e.eventType())).toList();
            assertEquals(1, tracked.size());
            assertEquals("ideal", tracked.get(0).payload().get("focalPoint"));
            assertEquals(1, meterRegistry.find("presence.pattern.confidence").summary().count());
        }

        @Test
        @DisplayName("null input text is tracked as an empty turn")
        void nullText() {
            var result = tracker.track("u1", null, null, null, null);
            assertEquals(FocalPoint.IDEAL, result.record().focalPoint());
            assertTrue(result.record().keywords().isEmpty());
        }

        @Test
        @DisplayName("concurrent turns for one user are all recorded")
        void concurrentTurns() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                var futures = new java.util.ArrayList<Future<?>>();
                for (int i = 0; i < 40; i++) {
                    int n = i;
                    futures.add(pool.submit(() -> tracker.track("u1", "topic" + n + " and weather", null, null, null)));
                }
                for (Future<?> f : futures) {
                    f.get(5, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }
            assertEquals(40, repository.history("u1").size());
            assertEquals(40, repository.profile("u1").orElseThrow().recurringThemes().get("weather"));
        }
    }

    @Nested
    @DisplayName("summary")
    class Summary {

        @Test
        @DisplayName("unknown user has an empty summary")
        void unknownUser() {
            var summary = tracker.summary("nobody");
            assertEquals(0, summary.recordCount());
            assertTrue(summary.insights().isEmpty());
            assertTrue(summary.recommendations().isEmpty());
            assertEquals(Trajectory.EXPANDING, summary.profile().trajectory());
        }

        @Test
        @DisplayName("reading the summary twice changes nothing")
        void idempotent() {
            for (int i = 0; i < 5; i++) {
                tracker.track("u1", "dream number" + i, FocalPoint.IDEAL, null, null);
            }
            int eventsBefore = events.size();

            var first = tracker.summary("u1");
            var second = tracker.summary("u1");

            assertEquals(first, second);
            assertEquals(5, repository.history("u1").size());
            assertEquals(eventsBefore, events.size());
        }

        @Test
        @DisplayName("five turns on one focal point recommend the next one")
        void approachShiftRecommended() {
            for (int i = 0; i < 5; i++) {
                tracker.track("u1", "dream number" + i, FocalPoint.IDEAL, null, null);
            }
            var summary = tracker.summary("u1");
            assertTrue(summary.recommendations().get(0).endsWith("Try turning toward shadow."));
            assertTrue(summary.insights().size() <= 2);
        }

        @Test
        @DisplayName("stuck point produces a recommendation")
        void stuckRecommendation() {
            for (int i = 0; i < 3; i++) {
                tracker.track("u1", "career money worries", i % 2 == 0 ? FocalPoint.SHADOW : FocalPoint.IDEAL, null, null);
            }
            var summary = tracker.summary("u1");
            assertTrue(summary.recommendations().get(0).contains("career, money, worries"));
            assertTrue(summary.insights().get(0).contains("career, money, worries"));
        }
    }
}
