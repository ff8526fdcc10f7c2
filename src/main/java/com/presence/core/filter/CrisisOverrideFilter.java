package com.presence.core.filter;

import com.presence.core.model.CrisisLevel;
import com.presence.core.selection.ResponseSelector;
import com.presence.core.stage.StageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the pre-computed crisis level into the stage's crisis behavior.
 * <p>
 * Red and yellow terminate the pipeline with an override directive; only red forces
 * the stage's element and archetype. Green records the monitor strategy and continues.
 */
@Component
public class CrisisOverrideFilter implements ResponseFilter {

    public static final String NAME = "crisis_override";

    private static final Logger log = LoggerFactory.getLogger(CrisisOverrideFilter.class);

    private final ResponseSelector selector;

    public CrisisOverrideFilter(ResponseSelector selector) {
        this.selector = selector;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FilterOutcome apply(FilterContext context, DirectiveBuilder directive) {
        CrisisLevel level = context.crisisLevel() != null ? context.crisisLevel() : CrisisLevel.GREEN;
        StageConfig.CrisisEntry entry = context.stage().crisis().entry(level);

        if (level == CrisisLevel.GREEN) {
            directive.strategy(entry.strategy());
            return FilterOutcome.CONTINUE;
        }

        String response = selector.select(entry.responses(), context.userId() + ":" + level.key()).orElse(null);
        if (level == CrisisLevel.RED) {
            directive.override(entry.strategy(), response, entry.element(), entry.archetype());
        } else {
            directive.override(entry.strategy(), response, null, null);
        }
        log.info("Crisis override {} for user {} on stage {} (strategy {})",
                level.key(), context.userId(), context.stage().id(), entry.strategy());
        return FilterOutcome.TERMINATE;
    }
}
