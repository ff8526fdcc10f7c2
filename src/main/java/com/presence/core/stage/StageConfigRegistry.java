package com.presence.core.stage;

import com.presence.core.filter.ResponseFilter;
import com.presence.core.model.CrisisLevel;
import com.presence.core.model.OverrideStrategy;
import com.presence.core.model.PersonaState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Process-wide, read-only table of stage definitions.
 * <p>
 * Built and validated once from {@link StageProperties}. Any inconsistency (missing default
 * stage, incomplete crisis block, a filter name that is neither implemented nor registered as
 * a placeholder) raises {@link StageConfigurationException} before the application serves traffic.
 * Lookups for unknown stage ids resolve to the configured default stage.
 */
@Service
public class StageConfigRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageConfigRegistry.class);

    private final Map<String, StageConfig> stages;
    private final String defaultStageId;
    private final Set<String> placeholders;

    public StageConfigRegistry(StageProperties properties, List<ResponseFilter> filters) {
        Set<String> implemented = new LinkedHashSet<>();
        for (ResponseFilter filter : filters) {
            implemented.add(filter.name());
        }
        this.placeholders = Set.copyOf(properties.getFilters().getPlaceholders());

        var errors = new ArrayList<String>();
        var built = new LinkedHashMap<String, StageConfig>();
        for (var entry : properties.getStages().entrySet()) {
            StageConfig stage = toStageConfig(entry.getKey(), entry.getValue(), errors);
            validateFilters(stage, implemented, errors);
            built.put(stage.id(), stage);
        }

        String configuredDefault = properties.getDefaultStage();
        if (configuredDefault == null || !built.containsKey(configuredDefault)) {
            errors.add("default stage '" + configuredDefault + "' is not a declared stage");
        }
        for (String placeholder : placeholders) {
            if (implemented.contains(placeholder)) {
                errors.add("filter '" + placeholder + "' is registered as a placeholder but has a handler");
            }
        }

        if (!errors.isEmpty()) {
            throw new StageConfigurationException("Invalid stage configuration: " + String.join("; ", errors));
        }

        this.stages = Map.copyOf(built);
        this.defaultStageId = configuredDefault;
        log.info("Loaded {} stages (default '{}'), filters implemented={}, placeholders={}",
                stages.size(), defaultStageId, implemented, placeholders);
    }

    /**
     * Returns the stage for the given id, or the default stage when the id is null or unknown.
     */
    public StageConfig get(String stageId) {
        if (stageId != null) {
            StageConfig stage = stages.get(stageId);
            if (stage != null) {
                return stage;
            }
        }
        log.warn("Unknown stage '{}', falling back to default stage '{}'", stageId, defaultStageId);
        return stages.get(defaultStageId);
    }

    public boolean contains(String stageId) {
        return stageId != null && stages.containsKey(stageId);
    }

    public String defaultStageId() {
        return defaultStageId;
    }

    public Collection<StageConfig> all() {
        return stages.values().stream()
                .sorted((a, b) -> a.id().compareTo(b.id()))
                .toList();
    }

    public boolean isPlaceholder(String filterName) {
        return placeholders.contains(filterName);
    }

    public int size() {
        return stages.size();
    }

    // -- conversion ---------------------------------------------------------

    private static StageConfig toStageConfig(String id, StageProperties.Stage source, List<String> errors) {
        var tone = source.getTone();
        checkUnit(id, "tone.formality", tone.getFormality(), errors);
        checkUnit(id, "tone.directness", tone.getDirectness(), errors);
        checkUnit(id, "tone.metaphysical-openness", tone.getMetaphysicalOpenness(), errors);

        return new StageConfig(
                id,
                source.getDisplayName() != null ? source.getDisplayName() : id,
                source.getDescription() != null ? source.getDescription() : "",
                new StageConfig.ToneVector(tone.getFormality(), tone.getDirectness(), tone.getMetaphysicalOpenness()),
                new StageConfig.DisclosureSettings(source.getDisclosure().getDepth(), source.getDisclosure().isShowReasoning()),
                source.getOrchestrationMode(),
                new StageConfig.VoiceDescriptor(source.getVoice().getStyle(), source.getVoice().getPace()),
                toOnboarding(id, source.getOnboarding(), errors),
                toCrisis(id, source.getCrisis(), errors),
                toMastery(id, source.getMastery(), errors),
                new StageConfig.FilterBlock(source.getFilters().getOrder(), Set.copyOf(source.getFilters().getEnabled())));
    }

    private static StageConfig.OnboardingBlock toOnboarding(String id, StageProperties.Onboarding source,
                                                            List<String> errors) {
        if (source == null) {
            return null;
        }
        if (source.getTones().isEmpty()) {
            errors.add("stage '" + id + "' declares an onboarding block without tones");
        }
        var rules = new ArrayList<StageConfig.ToneRule>();
        for (var tone : source.getTones()) {
            if (tone.getTone() == null || tone.getTone().isBlank()) {
                errors.add("stage '" + id + "' has an onboarding tone without a name");
                continue;
            }
            var bias = new LinkedHashMap<String, Double>();
            for (var delta : tone.getPersonaBias()) {
                if (!PersonaState.isDimension(delta.getDimension())) {
                    errors.add("stage '" + id + "' tone '" + tone.getTone()
                            + "' biases unknown persona dimension '" + delta.getDimension() + "'");
                    continue;
                }
                bias.merge(delta.getDimension(), delta.getDelta(), Double::sum);
            }
            rules.add(new StageConfig.ToneRule(tone.getTone(), tone.getKeywords(), tone.getResponses(), bias));
        }
        return new StageConfig.OnboardingBlock(rules);
    }

    private static StageConfig.CrisisBlock toCrisis(String id, Map<String, StageProperties.CrisisEntry> source,
                                                    List<String> errors) {
        var entries = new EnumMap<CrisisLevel, StageConfig.CrisisEntry>(CrisisLevel.class);
        for (CrisisLevel level : CrisisLevel.values()) {
            var entry = source.get(level.key());
            if (entry == null) {
                errors.add("stage '" + id + "' has no crisis entry for " + level.key());
                continue;
            }
            OverrideStrategy strategy;
            try {
                strategy = OverrideStrategy.fromKey(entry.getStrategy());
            } catch (RuntimeException e) {
                errors.add("stage '" + id + "' crisis " + level.key() + " has invalid strategy '"
                        + entry.getStrategy() + "'");
                continue;
            }
            if (level != CrisisLevel.GREEN && entry.getResponses().isEmpty()) {
                errors.add("stage '" + id + "' crisis " + level.key() + " has no canned responses");
            }
            if (level == CrisisLevel.RED && (isBlank(entry.getElement()) || isBlank(entry.getArchetype()))) {
                errors.add("stage '" + id + "' crisis red must force an element and an archetype");
            }
            entries.put(level, new StageConfig.CrisisEntry(strategy, entry.getResponses(),
                    level == CrisisLevel.RED ? entry.getElement() : null,
                    level == CrisisLevel.RED ? entry.getArchetype() : null));
        }
        return new StageConfig.CrisisBlock(entries);
    }

    private static StageConfig.MasteryVoiceBlock toMastery(String id, StageProperties.Mastery source,
                                                           List<String> errors) {
        if (source == null) {
            return null;
        }
        if (source.getMaxSentenceWords() < 1) {
            errors.add("stage '" + id + "' mastery max-sentence-words must be positive");
        }
        if (source.getMicroSilenceInterval() < 1) {
            errors.add("stage '" + id + "' mastery micro-silence-interval must be positive");
        }
        var jargon = source.getJargon().stream()
                .map(j -> new StageConfig.JargonRule(j.getTerm(), j.getPlain()))
                .toList();
        return new StageConfig.MasteryVoiceBlock(
                source.isEnabled(),
                source.getMinTrust(),
                source.getMinIntegration(),
                jargon,
                source.getMaxSentenceWords(),
                source.getMicroSilenceInterval(),
                source.getMicroSilenceMarker(),
                source.getClosingLines(),
                source.getParadoxLines());
    }

    private void validateFilters(StageConfig stage, Set<String> implemented, List<String> errors) {
        for (String name : stage.filters().order()) {
            if (!implemented.contains(name) && !placeholders.contains(name)) {
                errors.add("stage '" + stage.id() + "' declares unknown filter '" + name + "'");
            }
        }
        for (String name : stage.filters().enabled()) {
            if (!stage.filters().order().contains(name)) {
                errors.add("stage '" + stage.id() + "' enables filter '" + name + "' missing from its order");
            }
        }
    }

    private static void checkUnit(String id, String field, double value, List<String> errors) {
        if (value < 0.0 || value > 1.0) {
            errors.add("stage '" + id + "' " + field + " must be within 0..1 but was " + value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
