package com.presence.core.filter;

import com.presence.core.onboarding.OnboardingToneClassifier;
import com.presence.core.onboarding.ToneClassification;
import com.presence.core.selection.ResponseSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Classifies the input against the stage's onboarding tones and applies the matching
 * tone tag, canned response and persona-bias deltas. Stages without an onboarding block
 * pass through unchanged.
 */
@Component
public class OnboardingToneFilter implements ResponseFilter {

    public static final String NAME = "onboarding_tone";

    private static final Logger log = LoggerFactory.getLogger(OnboardingToneFilter.class);

    private final ResponseSelector selector;

    public OnboardingToneFilter(ResponseSelector selector) {
        this.selector = selector;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FilterOutcome apply(FilterContext context, DirectiveBuilder directive) {
        var onboarding = context.stage().onboarding();
        if (onboarding.isEmpty()) {
            return FilterOutcome.CONTINUE;
        }

        ToneClassification classification = OnboardingToneClassifier.classify(context.text(), onboarding.get());
        if (classification.isNeutral()) {
            log.debug("Onboarding tone neutral for user {}", context.userId());
            return FilterOutcome.CONTINUE;
        }

        var rule = classification.rule();
        directive.toneTag(rule.tone())
                .hint("onboarding_" + rule.tone())
                .addBiasDeltas(rule.personaBias());
        selector.select(rule.responses(), context.userId() + ":" + rule.tone())
                .ifPresent(directive::onboardingResponse);
        log.debug("Onboarding tone '{}' matched keyword '{}' for user {}",
                rule.tone(), classification.matchedKeyword(), context.userId());
        return FilterOutcome.CONTINUE;
    }
}
