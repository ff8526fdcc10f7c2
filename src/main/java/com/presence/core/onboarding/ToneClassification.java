package com.presence.core.onboarding;

import com.presence.core.stage.StageConfig;

/**
 * @param tone           matched tone, or "neutral"
 * @param matchedKeyword keyword that triggered the match; null when neutral
 * @param rule           the matching tone rule; null when neutral
 */
public record ToneClassification(String tone, String matchedKeyword, StageConfig.ToneRule rule) {

    public static ToneClassification neutral() {
        return new ToneClassification(OnboardingToneClassifier.NEUTRAL, null, null);
    }

    public boolean isNeutral() {
        return rule == null;
    }
}
