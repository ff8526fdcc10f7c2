package com.presence.core.filter;

/**
 * A named behavioral filter that a stage can declare in its filter order.
 * Implementations must be pure with respect to the context: they only write to the
 * supplied {@link DirectiveBuilder}.
 */
public interface ResponseFilter {

    /** Name used in stage configuration (e.g. "onboarding_tone"). */
    String name();

    /**
     * Applies this filter's effect to the directive under construction.
     *
     * @return {@link FilterOutcome#TERMINATE} to stop the pipeline with the directive as it stands
     */
    FilterOutcome apply(FilterContext context, DirectiveBuilder directive);
}
