package com.presence.core.stage;

import com.presence.core.filter.CrisisOverrideFilter;
import com.presence.core.filter.MasteryEligibilityFilter;
import com.presence.core.filter.OnboardingToneFilter;
import com.presence.core.filter.ResponseFilter;
import com.presence.core.filter.StageToneFilter;
import com.presence.core.model.CrisisLevel;
import com.presence.core.model.OverrideStrategy;
import com.presence.core.selection.HashResponseSelector;
import com.presence.core.selection.ResponseSelector;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stage definitions shared by the unit tests.
 */
public final class StageFixtures {

    public static final List<String> RED_RESPONSES = List.of(
            "Your safety matters most right now.", "Please reach out to someone you trust.");
    public static final List<String> YELLOW_RESPONSES = List.of(
            "Let's slow down and breathe.", "Let's pause together.");

    private StageFixtures() {}

    public static StageConfig.CrisisBlock crisisBlock() {
        return new StageConfig.CrisisBlock(Map.of(
                CrisisLevel.GREEN, new StageConfig.CrisisEntry(OverrideStrategy.MONITOR, List.of(), null, null),
                CrisisLevel.YELLOW, new StageConfig.CrisisEntry(OverrideStrategy.GROUNDING, YELLOW_RESPONSES, null, null),
                CrisisLevel.RED, new StageConfig.CrisisEntry(OverrideStrategy.OVERRIDE, RED_RESPONSES, "earth", "guardian")));
    }

    public static StageConfig.OnboardingBlock onboardingBlock() {
        return new StageConfig.OnboardingBlock(List.of(
                new StageConfig.ToneRule("curious", List.of("??", "curious", "wonder"),
                        List.of("Let's explore together."),
                        Map.of("challengeComfort", 0.1, "metaphysicsConfidence", 0.05)),
                new StageConfig.ToneRule("hesitant", List.of("maybe", "not sure", "nervous"),
                        List.of("There's no rush."),
                        Map.of("challengeComfort", -0.1, "trust", 0.05)),
                new StageConfig.ToneRule("enthusiastic", List.of("!", "excited"),
                        List.of("Let's put that energy to use."),
                        Map.of("humorAppreciation", 0.1))));
    }

    public static StageConfig.MasteryVoiceBlock masteryBlock() {
        return new StageConfig.MasteryVoiceBlock(true, 0.75, 0.6,
                List.of(new StageConfig.JargonRule("consciousness", "awareness"),
                        new StageConfig.JargonRule("integration", "bringing together")),
                12, 2, "...",
                List.of("Let's sit with that."),
                List.of("It can be both. No need to choose."));
    }

    public static StageConfig structuredGuide() {
        return new StageConfig("structured_guide", "Structured Guide", "",
                new StageConfig.ToneVector(0.7, 0.7, 0.2),
                new StageConfig.DisclosureSettings("minimal", false),
                "directive",
                new StageConfig.VoiceDescriptor("warm", "measured"),
                onboardingBlock(),
                crisisBlock(),
                null,
                new StageConfig.FilterBlock(
                        List.of("crisis_override", "onboarding_tone", "stage_tone", "mastery_eligibility"),
                        Set.of("crisis_override", "onboarding_tone", "stage_tone")));
    }

    public static StageConfig transparentPrism() {
        return new StageConfig("transparent_prism", "Transparent Prism", "",
                new StageConfig.ToneVector(0.2, 0.8, 0.8),
                new StageConfig.DisclosureSettings("full", true),
                "transparent",
                new StageConfig.VoiceDescriptor("spacious", "slow"),
                null,
                crisisBlock(),
                masteryBlock(),
                new StageConfig.FilterBlock(
                        List.of("crisis_override", "stage_tone", "mastery_eligibility", "prism_reflection"),
                        Set.of("crisis_override", "stage_tone", "mastery_eligibility", "prism_reflection")));
    }

    public static StageConfig withFilters(StageConfig base, List<String> order, Set<String> enabled) {
        return new StageConfig(base.id(), base.displayName(), base.description(), base.tone(), base.disclosure(),
                base.orchestrationMode(), base.voice(), base.onboardingBlock(), base.crisis(), base.masteryBlock(),
                new StageConfig.FilterBlock(order, enabled));
    }

    /** The four concrete filters, sharing one hash selector. */
    public static List<ResponseFilter> filters() {
        ResponseSelector selector = new HashResponseSelector(0);
        return List.of(
                new CrisisOverrideFilter(selector),
                new OnboardingToneFilter(selector),
                new StageToneFilter(),
                new MasteryEligibilityFilter());
    }

    /** A minimal valid binding target with a single stage. */
    public static StageProperties minimalProperties() {
        var properties = new StageProperties();
        properties.setDefaultStage("guide");
        properties.getStages().put("guide", propertiesStage());
        return properties;
    }

    public static StageProperties.Stage propertiesStage() {
        var stage = new StageProperties.Stage();
        stage.setDisplayName("Guide");
        stage.getCrisis().put("green", crisisEntry("monitor", List.of(), null, null));
        stage.getCrisis().put("yellow", crisisEntry("grounding", YELLOW_RESPONSES, null, null));
        stage.getCrisis().put("red", crisisEntry("override", RED_RESPONSES, "earth", "guardian"));
        stage.getFilters().setOrder(new ArrayList<>(List.of("crisis_override", "stage_tone")));
        stage.getFilters().setEnabled(new ArrayList<>(List.of("crisis_override", "stage_tone")));
        return stage;
    }

    public static StageProperties.CrisisEntry crisisEntry(String strategy, List<String> responses,
                                                          String element, String archetype) {
        var entry = new StageProperties.CrisisEntry();
        entry.setStrategy(strategy);
        entry.setResponses(new ArrayList<>(responses));
        entry.setElement(element);
        entry.setArchetype(archetype);
        return entry;
    }

    /** Binds {@code presence.*} from the packaged application.yml. */
    public static StageProperties applicationProperties() {
        try {
            var sources = new YamlPropertySourceLoader().load("application", new ClassPathResource("application.yml"));
            return new Binder(ConfigurationPropertySources.from(sources))
                    .bind("presence", StageProperties.class)
                    .get();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Registry over the packaged stage table, wired with the concrete filters. */
    public static StageConfigRegistry applicationRegistry() {
        return new StageConfigRegistry(applicationProperties(), filters());
    }
}
