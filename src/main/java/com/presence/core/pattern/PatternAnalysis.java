package com.presence.core.pattern;

import com.presence.core.model.FocalPoint;
import com.presence.core.model.PatternRecord;
import com.presence.core.model.RelatedPattern;
import com.presence.core.model.Resolution;
import com.presence.core.model.Trajectory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Stateless heuristics over a user's record history. Every method takes records oldest first
 * and never mutates them.
 */
public final class PatternAnalysis {

    static final double BASE_CONFIDENCE = 0.5;
    static final int MIN_RECORDS_FOR_TRAJECTORY = 5;
    static final double CYCLING_RATIO = 0.3;
    static final int STUCK_THRESHOLD = 3;
    static final int MIN_SHARED_KEYWORDS = 2;
    static final int IMBALANCE_THRESHOLD = 2;
    static final double RESOURCES_SHARE = 0.2;
    static final double LOW_CONFIDENCE = 0.6;

    static final String EMPTY_SIGNATURE_LABEL = "messages without a clear topic";

    static final List<String> RESOLUTION_MARKERS = List.of(
            "i realize", "now i see", "makes sense", "i understand now", "breakthrough", "finally");

    private PatternAnalysis() {} // utility class

    /** The last {@code size} records, or all of them when there are fewer. */
    public static List<PatternRecord> window(List<PatternRecord> history, int size) {
        return history.size() <= size ? history : history.subList(history.size() - size, history.size());
    }

    /**
     * 0.5 plus 0.1 per marker of the focal point found in the text, capped at 1.0.
     */
    public static double confidence(String text, List<String> focalMarkers) {
        int matches = FocalPointDetector.countMarkers(text, focalMarkers);
        // integer tenths keep 4 matches at exactly 0.9
        return Math.min(1.0, (BASE_CONFIDENCE * 10 + matches) / 10.0);
    }

    /**
     * Records in the window sharing at least two keywords with the current set, most recent first.
     */
    public static List<RelatedPattern> relatedPatterns(List<String> keywords, List<PatternRecord> window, int limit) {
        var related = new ArrayList<RelatedPattern>();
        if (keywords.size() < MIN_SHARED_KEYWORDS) {
            return related;
        }
        for (int i = window.size() - 1; i >= 0 && related.size() < limit; i--) {
            PatternRecord record = window.get(i);
            Set<String> theirs = new HashSet<>(record.keywords());
            List<String> overlap = keywords.stream().filter(theirs::contains).toList();
            if (overlap.size() >= MIN_SHARED_KEYWORDS) {
                related.add(new RelatedPattern(record.focalPoint(), record.element(), overlap));
            }
        }
        return related;
    }

    /**
     * Most frequent focal point in the window; ties go to the one seen first. Null for an empty window.
     */
    public static FocalPoint dominantFocus(List<PatternRecord> window) {
        var counts = new LinkedHashMap<FocalPoint, Integer>();
        for (PatternRecord record : window) {
            counts.merge(record.focalPoint(), 1, Integer::sum);
        }
        FocalPoint best = null;
        int bestCount = 0;
        for (var entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    /**
     * Checked in order: too little history, repeated signatures, single focus, wide focus.
     *
     * @param totalRecords number of records the user has in total
     * @param window       the profile window
     * @param windowSize   configured profile window size; the cycling threshold is 30% of it
     */
    public static Trajectory trajectory(int totalRecords, List<PatternRecord> window, int windowSize) {
        if (totalRecords < MIN_RECORDS_FOR_TRAJECTORY) {
            return Trajectory.EXPANDING;
        }
        long distinctSignatures = window.stream().map(PatternRecord::signature).distinct().count();
        if (distinctSignatures < CYCLING_RATIO * windowSize) {
            return Trajectory.CYCLING;
        }
        long distinctFocus = window.stream().map(PatternRecord::focalPoint).distinct().count();
        if (distinctFocus == 1) {
            return Trajectory.DEEPENING;
        }
        if (distinctFocus >= 3) {
            return Trajectory.INTEGRATING;
        }
        return Trajectory.EXPANDING;
    }

    /**
     * Signatures occurring three or more times in the window, in first-seen order.
     * The empty signature of keyword-less turns counts like any other.
     */
    public static List<String> stuckPoints(List<PatternRecord> window) {
        var counts = new LinkedHashMap<String, Integer>();
        for (PatternRecord record : window) {
            counts.merge(record.signature(), 1, Integer::sum);
        }
        return counts.entrySet().stream()
                .filter(e -> e.getValue() >= STUCK_THRESHOLD)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Stuck if the signature was already seen twice in the window, resolved if the exchange
     * contains a resolution marker, recurring if related patterns exist, evolving otherwise.
     */
    public static Resolution resolution(String signature, List<PatternRecord> window, String inputText,
                                        String response, boolean hasRelated) {
        long seen = window.stream().filter(r -> r.signature().equals(signature)).count();
        if (seen >= STUCK_THRESHOLD - 1) {
            return Resolution.STUCK;
        }
        String exchange = ((inputText != null ? inputText : "") + " " + (response != null ? response : ""))
                .toLowerCase();
        for (String marker : RESOLUTION_MARKERS) {
            if (exchange.contains(marker)) {
                return Resolution.RESOLVED;
            }
        }
        return hasRelated ? Resolution.RECURRING : Resolution.EVOLVING;
    }

    /**
     * Up to {@code limit} insights, in priority order. Empty for a user without history.
     */
    public static List<String> insights(List<PatternRecord> history, List<String> stuckPoints, Trajectory trajectory,
                                        int relatedWindow, int recentWindow, int limit) {
        var insights = new ArrayList<String>();
        if (history.isEmpty()) {
            return insights;
        }

        if (!stuckPoints.isEmpty()) {
            insights.add("You keep circling back to the same ground (" + describe(stuckPoints.get(0))
                    + "). Something here wants attention.");
        }

        if (insights.size() < limit) {
            var counts = focalCounts(window(history, relatedWindow));
            for (FocalPoint fp : FocalPoint.values()) {
                if (counts.get(fp) < IMBALANCE_THRESHOLD) {
                    insights.add("The " + fp.key() + " side has barely come up lately. It may be worth a look.");
                    break;
                }
            }
        }

        if (insights.size() < limit) {
            trajectoryInsight(trajectory).ifPresent(insights::add);
        }

        if (insights.size() < limit) {
            long resources = history.stream().filter(r -> r.focalPoint() == FocalPoint.RESOURCES).count();
            if (resources < RESOURCES_SHARE * history.size()) {
                insights.add("We rarely talk about what supports you. What already helps?");
            }
        }

        if (insights.size() < limit) {
            shadowIdealConnection(window(history, recentWindow)).ifPresent(insights::add);
        }
        return insights;
    }

    /**
     * Suggests a change of lens when the recent window is stuck on one focal point,
     * or a re-centering prompt when its average confidence is low. Needs a full recent window.
     */
    public static Optional<String> approachShift(List<PatternRecord> history, int recentWindow) {
        if (history.size() < recentWindow || recentWindow <= 0) {
            return Optional.empty();
        }
        List<PatternRecord> recent = window(history, recentWindow);
        FocalPoint first = recent.get(0).focalPoint();
        if (recent.stream().allMatch(r -> r.focalPoint() == first)) {
            FocalPoint next = first.next();
            return Optional.of("We've stayed with " + first.key() + " for a while. Try turning toward "
                    + next.key() + ".");
        }
        double average = recent.stream().mapToDouble(PatternRecord::confidence).average().orElse(1.0);
        if (average < LOW_CONFIDENCE) {
            return Optional.of("Let's pause and come back to what matters most to you right now.");
        }
        return Optional.empty();
    }

    public static String stuckPointRecommendation(String signature) {
        return "Approach '" + describe(signature) + "' from a new angle instead of going over it again.";
    }

    static String describe(String signature) {
        return signature.isEmpty() ? EMPTY_SIGNATURE_LABEL : signature.replace(",", ", ");
    }

    private static Optional<String> trajectoryInsight(Trajectory trajectory) {
        return switch (trajectory) {
            case CYCLING -> Optional.of("The same themes keep returning. The loop itself may be the message.");
            case INTEGRATING -> Optional.of("You're weaving several sides together. That is integration at work.");
            case DEEPENING -> Optional.of("You're going deeper into one area. Notice what opens there.");
            case EXPANDING -> Optional.empty();
        };
    }

    private static Optional<String> shadowIdealConnection(List<PatternRecord> recent) {
        Set<String> shadow = new HashSet<>();
        Set<String> ideal = new HashSet<>();
        for (PatternRecord record : recent) {
            if (record.focalPoint() == FocalPoint.SHADOW) {
                shadow.addAll(record.keywords());
            } else if (record.focalPoint() == FocalPoint.IDEAL) {
                ideal.addAll(record.keywords());
            }
        }
        return shadow.stream()
                .filter(ideal::contains)
                .sorted()
                .findFirst()
                .map(shared -> "What you fear and what you hope for both touch '" + shared
                        + "'. They may be one thread.");
    }

    private static Map<FocalPoint, Integer> focalCounts(List<PatternRecord> records) {
        var counts = new EnumMap<FocalPoint, Integer>(FocalPoint.class);
        for (FocalPoint fp : FocalPoint.values()) {
            counts.put(fp, 0);
        }
        for (PatternRecord record : records) {
            counts.merge(record.focalPoint(), 1, Integer::sum);
        }
        return counts;
    }
}
