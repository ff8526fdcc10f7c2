package com.presence.core.filter;

import com.presence.core.mastery.MasteryVoiceProcessor;
import org.springframework.stereotype.Component;

/**
 * Flags the directive when the mastery voice will shape this turn's generated text,
 * so the generator can already aim for short, plain sentences.
 */
@Component
public class MasteryEligibilityFilter implements ResponseFilter {

    public static final String NAME = "mastery_eligibility";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FilterOutcome apply(FilterContext context, DirectiveBuilder directive) {
        boolean active = MasteryVoiceProcessor.isActive(context.stage(), context.persona());
        directive.masteryVoiceActive(active);
        if (active) {
            directive.hint("mastery_voice");
        }
        return FilterOutcome.CONTINUE;
    }
}
