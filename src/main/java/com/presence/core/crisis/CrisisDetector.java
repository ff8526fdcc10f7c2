package com.presence.core.crisis;

import com.presence.core.model.CrisisLevel;

import java.util.List;

/**
 * Scans raw user text for safety keywords and classifies it as green, yellow or red.
 * <p>
 * The keyword lists are stage-independent and evaluated before any stage lookup.
 * Red keywords take strict precedence over yellow ones. Matching is a case-insensitive
 * substring test.
 */
public final class CrisisDetector {

    static final List<String> RED_KEYWORDS = List.of(
            "hopeless",
            "suicide",
            "kill myself",
            "end it all",
            "want to die",
            "don't want to live",
            "no reason to live",
            "self harm",
            "hurt myself",
            "better off dead",
            "can't go on"
    );

    static final List<String> YELLOW_KEYWORDS = List.of(
            "overwhelmed",
            "panic",
            "anxious",
            "can't cope",
            "falling apart",
            "too much",
            "breaking down",
            "scared",
            "can't breathe"
    );

    private CrisisDetector() {} // utility class

    /**
     * Classifies the given text. Never throws; null or blank text is green.
     *
     * @param text raw user text
     * @return the crisis level
     */
    public static CrisisLevel detect(String text) {
        if (text == null || text.isBlank()) {
            return CrisisLevel.GREEN;
        }
        String lowerText = normalizeApostrophes(text.toLowerCase());
        if (containsAny(lowerText, RED_KEYWORDS)) {
            return CrisisLevel.RED;
        }
        if (containsAny(lowerText, YELLOW_KEYWORDS)) {
            return CrisisLevel.YELLOW;
        }
        return CrisisLevel.GREEN;
    }

    private static boolean containsAny(String lowerText, List<String> keywords) {
        for (String keyword : keywords) {
            if (lowerText.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    // Typographic apostrophes from mobile keyboards would otherwise miss "can't go on"
    private static String normalizeApostrophes(String text) {
        return text.replace('’', '\'');
    }
}
