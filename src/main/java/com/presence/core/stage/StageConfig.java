package com.presence.core.stage;

import com.presence.core.model.CrisisLevel;
import com.presence.core.model.OverrideStrategy;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable definition of one relationship stage.
 * <p>
 * The base fields are always present. The onboarding and mastery-voice blocks are optional
 * capabilities: callers check them through {@link #onboarding()} and {@link #mastery()}.
 */
public record StageConfig(
    String id,
    String displayName,
    String description,
    ToneVector tone,
    DisclosureSettings disclosure,
    String orchestrationMode,
    VoiceDescriptor voice,
    OnboardingBlock onboardingBlock,
    CrisisBlock crisis,
    MasteryVoiceBlock masteryBlock,
    FilterBlock filters
) implements Serializable {

    public Optional<OnboardingBlock> onboarding() {
        return Optional.ofNullable(onboardingBlock);
    }

    public Optional<MasteryVoiceBlock> mastery() {
        return Optional.ofNullable(masteryBlock);
    }

    public record ToneVector(double formality, double directness, double metaphysicalOpenness) implements Serializable {}

    public record DisclosureSettings(String depth, boolean showReasoning) implements Serializable {}

    public record VoiceDescriptor(String style, String pace) implements Serializable {}

    /**
     * Tone rules in declared order. The first rule whose keywords match wins.
     */
    public record OnboardingBlock(List<ToneRule> tones) implements Serializable {
        public OnboardingBlock {
            tones = List.copyOf(tones);
        }
    }

    public record ToneRule(
        String tone,
        List<String> keywords,
        List<String> responses,
        Map<String, Double> personaBias
    ) implements Serializable {
        public ToneRule {
            keywords = List.copyOf(keywords);
            responses = List.copyOf(responses);
            personaBias = Map.copyOf(personaBias);
        }
    }

    public record CrisisEntry(
        OverrideStrategy strategy,
        List<String> responses,
        String element,
        String archetype
    ) implements Serializable {
        public CrisisEntry {
            responses = List.copyOf(responses);
        }
    }

    public record CrisisBlock(Map<CrisisLevel, CrisisEntry> entries) implements Serializable {
        public CrisisBlock {
            var copy = new EnumMap<CrisisLevel, CrisisEntry>(CrisisLevel.class);
            copy.putAll(entries);
            entries = Collections.unmodifiableMap(copy);
        }

        public CrisisEntry entry(CrisisLevel level) {
            return entries.get(level);
        }
    }

    public record JargonRule(String term, String plain) implements Serializable {}

    /**
     * @param minIntegration nullable; when absent only trust gates activation
     */
    public record MasteryVoiceBlock(
        boolean enabled,
        double minTrust,
        Double minIntegration,
        List<JargonRule> jargon,
        int maxSentenceWords,
        int microSilenceInterval,
        String microSilenceMarker,
        List<String> closingLines,
        List<String> paradoxLines
    ) implements Serializable {
        public MasteryVoiceBlock {
            jargon = List.copyOf(jargon);
            closingLines = List.copyOf(closingLines);
            paradoxLines = List.copyOf(paradoxLines);
        }
    }

    /**
     * @param order   filter names to consider, in execution order
     * @param enabled subset of {@code order} that actually runs
     */
    public record FilterBlock(List<String> order, Set<String> enabled) implements Serializable {
        public FilterBlock {
            order = List.copyOf(order);
            enabled = Set.copyOf(enabled);
        }

        /** Filters present in both the order and the enabled set, in declared order. */
        public List<String> active() {
            return order.stream().filter(enabled::contains).toList();
        }
    }
}
