package com.presence.core.filter;

import com.presence.core.model.CrisisLevel;
import com.presence.core.model.OverrideStrategy;
import com.presence.core.model.ResponseDirective;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable accumulator for a {@link ResponseDirective}, owned by a single pipeline run.
 */
public class DirectiveBuilder {

    private boolean overrideActive;
    private OverrideStrategy strategy = OverrideStrategy.MONITOR;
    private String overrideResponse;
    private String forcedElement;
    private String forcedArchetype;
    private final Map<String, Double> personaBiasDeltas = new LinkedHashMap<>();
    private String toneTag;
    private String onboardingResponse;
    private final List<String> templateHints = new ArrayList<>();
    private boolean masteryVoiceActive;
    private final List<String> executedFilters = new ArrayList<>();

    public DirectiveBuilder strategy(OverrideStrategy strategy) {
        this.strategy = strategy;
        return this;
    }

    /**
     * Marks the directive as a crisis override. Element and archetype are only forced for red.
     */
    public DirectiveBuilder override(OverrideStrategy strategy, String response, String element, String archetype) {
        this.overrideActive = true;
        this.strategy = strategy;
        this.overrideResponse = response;
        this.forcedElement = element;
        this.forcedArchetype = archetype;
        return this;
    }

    /** Adds deltas to any already accumulated for the same dimension. */
    public DirectiveBuilder addBiasDeltas(Map<String, Double> deltas) {
        deltas.forEach((dimension, delta) -> personaBiasDeltas.merge(dimension, delta, Double::sum));
        return this;
    }

    public DirectiveBuilder toneTag(String toneTag) {
        this.toneTag = toneTag;
        return this;
    }

    public DirectiveBuilder toneTagIfAbsent(String toneTag) {
        if (this.toneTag == null) {
            this.toneTag = toneTag;
        }
        return this;
    }

    public DirectiveBuilder onboardingResponse(String onboardingResponse) {
        this.onboardingResponse = onboardingResponse;
        return this;
    }

    public DirectiveBuilder hint(String hint) {
        templateHints.add(hint);
        return this;
    }

    public DirectiveBuilder masteryVoiceActive(boolean active) {
        this.masteryVoiceActive = active;
        return this;
    }

    DirectiveBuilder executed(String filterName) {
        executedFilters.add(filterName);
        return this;
    }

    public String toneTag() {
        return toneTag;
    }

    public ResponseDirective build(String stageId, CrisisLevel crisisLevel) {
        return new ResponseDirective(
                stageId,
                crisisLevel,
                overrideActive,
                strategy,
                overrideResponse,
                forcedElement,
                forcedArchetype,
                Map.copyOf(personaBiasDeltas),
                toneTag,
                onboardingResponse,
                List.copyOf(templateHints),
                masteryVoiceActive,
                List.copyOf(executedFilters),
                List.of(),
                List.of());
    }
}
