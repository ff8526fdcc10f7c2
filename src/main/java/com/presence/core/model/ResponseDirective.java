package com.presence.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Structured instruction set handed to the text generation collaborator for one turn.
 *
 * @param stageId            the stage the directive was resolved against (after default fallback)
 * @param crisisLevel        crisis classification of the raw input
 * @param overrideActive     true when a crisis override supersedes normal behavior
 * @param strategy           monitor, grounding or override
 * @param overrideResponse   canned crisis response; nullable when no override is active
 * @param forcedElement      element tag forced by a red override; nullable otherwise
 * @param forcedArchetype    archetype tag forced by a red override; nullable otherwise
 * @param personaBiasDeltas  accumulated persona-bias deltas from all executed filters
 * @param toneTag            selected tone tag; nullable when no filter set one
 * @param onboardingResponse canned onboarding response for the detected tone; nullable
 * @param templateHints      generation hints accumulated by filters, in execution order
 * @param masteryVoiceActive whether mastery voice post-processing will apply to this turn
 * @param executedFilters    filter names that ran, in order
 * @param insights           up to two longitudinal insights
 * @param recommendations    up to two longitudinal recommendations
 */
public record ResponseDirective(
    @JsonProperty("stage_id") String stageId,
    @JsonProperty("crisis_level") CrisisLevel crisisLevel,
    @JsonProperty("override_active") boolean overrideActive,
    OverrideStrategy strategy,
    @JsonProperty("override_response") String overrideResponse,
    @JsonProperty("forced_element") String forcedElement,
    @JsonProperty("forced_archetype") String forcedArchetype,
    @JsonProperty("persona_bias_deltas") Map<String, Double> personaBiasDeltas,
    @JsonProperty("tone_tag") String toneTag,
    @JsonProperty("onboarding_response") String onboardingResponse,
    @JsonProperty("template_hints") List<String> templateHints,
    @JsonProperty("mastery_voice_active") boolean masteryVoiceActive,
    @JsonProperty("executed_filters") List<String> executedFilters,
    List<String> insights,
    List<String> recommendations
) implements Serializable {

    public static final int MAX_INSIGHTS = 2;
    public static final int MAX_RECOMMENDATIONS = 2;

    /**
     * Returns a copy carrying the given longitudinal guidance, each list capped at two entries.
     */
    public ResponseDirective withGuidance(List<String> newInsights, List<String> newRecommendations) {
        return new ResponseDirective(stageId, crisisLevel, overrideActive, strategy, overrideResponse,
                forcedElement, forcedArchetype, personaBiasDeltas, toneTag, onboardingResponse,
                templateHints, masteryVoiceActive, executedFilters,
                cap(newInsights, MAX_INSIGHTS), cap(newRecommendations, MAX_RECOMMENDATIONS));
    }

    private static List<String> cap(List<String> values, int max) {
        if (values == null) {
            return List.of();
        }
        return values.size() <= max ? List.copyOf(values) : List.copyOf(values.subList(0, max));
    }
}
