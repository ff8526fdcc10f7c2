package com.presence.core.pattern;

import com.presence.core.model.FocalPoint;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Window sizes, store timeout and focal point marker lists for pattern tracking,
 * bound from {@code presence.tracking.*}.
 */
@Component
@ConfigurationProperties(prefix = "presence.tracking")
public class TrackingProperties {

    /** Records considered for dominant focus, trajectory and stuck points. */
    private int profileWindow = 10;

    /** Records scanned for related patterns and the imbalance insight. */
    private int relatedWindow = 20;

    /** Records considered for approach-shift suggestions and the shadow/ideal insight. */
    private int recentWindow = 5;

    private int maxRelated = 3;
    private int breakthroughLimit = 10;
    private long storeTimeoutMs = 2000;

    /** Marker words per focal point key ("ideal", "shadow", "resources", "outcome"). */
    private Map<String, List<String>> focalMarkers = defaultMarkers();

    public int getProfileWindow() { return profileWindow; }
    public void setProfileWindow(int profileWindow) { this.profileWindow = profileWindow; }
    public int getRelatedWindow() { return relatedWindow; }
    public void setRelatedWindow(int relatedWindow) { this.relatedWindow = relatedWindow; }
    public int getRecentWindow() { return recentWindow; }
    public void setRecentWindow(int recentWindow) { this.recentWindow = recentWindow; }
    public int getMaxRelated() { return maxRelated; }
    public void setMaxRelated(int maxRelated) { this.maxRelated = maxRelated; }
    public int getBreakthroughLimit() { return breakthroughLimit; }
    public void setBreakthroughLimit(int breakthroughLimit) { this.breakthroughLimit = breakthroughLimit; }
    public long getStoreTimeoutMs() { return storeTimeoutMs; }
    public void setStoreTimeoutMs(long storeTimeoutMs) { this.storeTimeoutMs = storeTimeoutMs; }
    public Map<String, List<String>> getFocalMarkers() { return focalMarkers; }
    public void setFocalMarkers(Map<String, List<String>> focalMarkers) { this.focalMarkers = focalMarkers; }

    public List<String> markersFor(FocalPoint focalPoint) {
        return focalMarkers.getOrDefault(focalPoint.key(), List.of());
    }

    private static Map<String, List<String>> defaultMarkers() {
        var markers = new LinkedHashMap<String, List<String>>();
        markers.put("ideal", new ArrayList<>(List.of(
                "dream", "vision", "hope", "want", "wish", "ideal", "aspire", "imagine", "purpose", "calling")));
        markers.put("shadow", new ArrayList<>(List.of(
                "fear", "afraid", "block", "resist", "avoid", "shame", "stuck", "struggle", "dark", "hide")));
        markers.put("resources", new ArrayList<>(List.of(
                "support", "strength", "skill", "help", "resource", "tool", "friend", "ally", "practice", "ground")));
        markers.put("outcome", new ArrayList<>(List.of(
                "result", "goal", "achieve", "outcome", "happen", "next", "plan", "step", "change", "future")));
        return markers;
    }
}
