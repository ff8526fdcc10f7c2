package com.presence.core.pattern;

import com.presence.core.model.FocalPoint;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks the focal point whose marker words occur most often in a message.
 * Ties go to the earlier focal point in declaration order; no hits at all means {@link FocalPoint#IDEAL}.
 */
@Component
public class FocalPointDetector {

    private final TrackingProperties properties;

    public FocalPointDetector(TrackingProperties properties) {
        this.properties = properties;
    }

    public FocalPoint detect(String text) {
        FocalPoint best = FocalPoint.IDEAL;
        int bestCount = 0;
        for (FocalPoint candidate : FocalPoint.values()) {
            int count = countMarkers(text, properties.markersFor(candidate));
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    /**
     * Number of distinct markers found as case-insensitive substrings of the text.
     */
    static int countMarkers(String text, List<String> markers) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        String lowerText = text.toLowerCase();
        int count = 0;
        for (String marker : markers) {
            if (marker != null && !marker.isEmpty() && lowerText.contains(marker.toLowerCase())) {
                count++;
            }
        }
        return count;
    }
}
