package com.presence.core.onboarding;

import com.presence.core.stage.StageConfig;

/**
 * Classifies free text into one of a stage's declared onboarding tones.
 * <p>
 * Tones are tried strictly in declared order. A tone matches when any of its keywords
 * occurs in the lower-cased input, or occurs verbatim in the raw input. The first
 * matching tone wins; otherwise the text is {@link #NEUTRAL}.
 */
public final class OnboardingToneClassifier {

    public static final String NEUTRAL = "neutral";

    private OnboardingToneClassifier() {} // utility class

    public static ToneClassification classify(String text, StageConfig.OnboardingBlock onboarding) {
        if (text == null || text.isEmpty() || onboarding == null) {
            return ToneClassification.neutral();
        }
        String lowerText = text.toLowerCase();
        for (StageConfig.ToneRule rule : onboarding.tones()) {
            for (String keyword : rule.keywords()) {
                if (keyword == null || keyword.isEmpty()) {
                    continue;
                }
                if (lowerText.contains(keyword.toLowerCase()) || text.contains(keyword)) {
                    return new ToneClassification(rule.tone(), keyword, rule);
                }
            }
        }
        return ToneClassification.neutral();
    }
}
