package com.presence.core.filter;

import com.presence.core.stage.StageConfig;
import org.springframework.stereotype.Component;

/**
 * Translates the stage's tone vector, disclosure settings and voice into generation hints.
 * The stage voice style becomes the tone tag unless an earlier filter already chose one.
 */
@Component
public class StageToneFilter implements ResponseFilter {

    public static final String NAME = "stage_tone";

    static final double HIGH = 0.6;
    static final double LOW = 0.4;
    static final double GROUNDED = 0.3;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FilterOutcome apply(FilterContext context, DirectiveBuilder directive) {
        StageConfig stage = context.stage();
        StageConfig.ToneVector tone = stage.tone();

        if (tone.formality() >= HIGH) {
            directive.hint("formal_register");
        } else if (tone.formality() <= LOW) {
            directive.hint("casual_register");
        }
        if (tone.directness() >= HIGH) {
            directive.hint("direct");
        }
        if (tone.metaphysicalOpenness() >= HIGH) {
            directive.hint("metaphysics_open");
        } else if (tone.metaphysicalOpenness() <= GROUNDED) {
            directive.hint("grounded_language");
        }
        directive.hint("disclosure_" + stage.disclosure().depth());
        if (stage.disclosure().showReasoning()) {
            directive.hint("show_reasoning");
        }
        directive.toneTagIfAbsent(stage.voice().style());
        return FilterOutcome.CONTINUE;
    }
}
