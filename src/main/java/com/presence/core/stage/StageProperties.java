package com.presence.core.stage;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative stage table bound from {@code presence.*}.
 * <p>
 * Everything whose order matters (onboarding tones, filter order, jargon substitutions)
 * is bound as a list. {@link StageConfigRegistry} turns this mutable binding target into
 * immutable {@link StageConfig} records once at startup.
 */
@Component
@ConfigurationProperties(prefix = "presence")
public class StageProperties {

    private String defaultStage = "structured_guide";
    private Map<String, Stage> stages = new LinkedHashMap<>();
    private Filters filters = new Filters();
    private Selection selection = new Selection();

    public String getDefaultStage() { return defaultStage; }
    public void setDefaultStage(String defaultStage) { this.defaultStage = defaultStage; }
    public Map<String, Stage> getStages() { return stages; }
    public void setStages(Map<String, Stage> stages) { this.stages = stages; }
    public Filters getFilters() { return filters; }
    public void setFilters(Filters filters) { this.filters = filters; }
    public Selection getSelection() { return selection; }
    public void setSelection(Selection selection) { this.selection = selection; }

    public static class Filters {
        /** Filter names accepted as intentional pass-through hooks. */
        private List<String> placeholders = new ArrayList<>();

        public List<String> getPlaceholders() { return placeholders; }
        public void setPlaceholders(List<String> placeholders) { this.placeholders = placeholders; }
    }

    public static class Selection {
        /** "hash" or "round-robin". */
        private String strategy = "hash";
        private long seed = 0L;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public long getSeed() { return seed; }
        public void setSeed(long seed) { this.seed = seed; }
    }

    public static class Stage {
        private String displayName;
        private String description = "";
        private Tone tone = new Tone();
        private Disclosure disclosure = new Disclosure();
        private String orchestrationMode = "directive";
        private Voice voice = new Voice();
        private Onboarding onboarding;
        private Map<String, CrisisEntry> crisis = new LinkedHashMap<>();
        private Mastery mastery;
        private FilterSet filters = new FilterSet();

        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public Tone getTone() { return tone; }
        public void setTone(Tone tone) { this.tone = tone; }
        public Disclosure getDisclosure() { return disclosure; }
        public void setDisclosure(Disclosure disclosure) { this.disclosure = disclosure; }
        public String getOrchestrationMode() { return orchestrationMode; }
        public void setOrchestrationMode(String orchestrationMode) { this.orchestrationMode = orchestrationMode; }
        public Voice getVoice() { return voice; }
        public void setVoice(Voice voice) { this.voice = voice; }
        public Onboarding getOnboarding() { return onboarding; }
        public void setOnboarding(Onboarding onboarding) { this.onboarding = onboarding; }
        public Map<String, CrisisEntry> getCrisis() { return crisis; }
        public void setCrisis(Map<String, CrisisEntry> crisis) { this.crisis = crisis; }
        public Mastery getMastery() { return mastery; }
        public void setMastery(Mastery mastery) { this.mastery = mastery; }
        public FilterSet getFilters() { return filters; }
        public void setFilters(FilterSet filters) { this.filters = filters; }
    }

    public static class Tone {
        private double formality = 0.5;
        private double directness = 0.5;
        private double metaphysicalOpenness = 0.5;

        public double getFormality() { return formality; }
        public void setFormality(double formality) { this.formality = formality; }
        public double getDirectness() { return directness; }
        public void setDirectness(double directness) { this.directness = directness; }
        public double getMetaphysicalOpenness() { return metaphysicalOpenness; }
        public void setMetaphysicalOpenness(double metaphysicalOpenness) { this.metaphysicalOpenness = metaphysicalOpenness; }
    }

    public static class Disclosure {
        private String depth = "minimal";
        private boolean showReasoning = false;

        public String getDepth() { return depth; }
        public void setDepth(String depth) { this.depth = depth; }
        public boolean isShowReasoning() { return showReasoning; }
        public void setShowReasoning(boolean showReasoning) { this.showReasoning = showReasoning; }
    }

    public static class Voice {
        private String style = "warm";
        private String pace = "moderate";

        public String getStyle() { return style; }
        public void setStyle(String style) { this.style = style; }
        public String getPace() { return pace; }
        public void setPace(String pace) { this.pace = pace; }
    }

    public static class Onboarding {
        private List<ToneRule> tones = new ArrayList<>();

        public List<ToneRule> getTones() { return tones; }
        public void setTones(List<ToneRule> tones) { this.tones = tones; }
    }

    public static class ToneRule {
        private String tone;
        private List<String> keywords = new ArrayList<>();
        private List<String> responses = new ArrayList<>();
        private List<BiasDelta> personaBias = new ArrayList<>();

        public String getTone() { return tone; }
        public void setTone(String tone) { this.tone = tone; }
        public List<String> getKeywords() { return keywords; }
        public void setKeywords(List<String> keywords) { this.keywords = keywords; }
        public List<String> getResponses() { return responses; }
        public void setResponses(List<String> responses) { this.responses = responses; }
        public List<BiasDelta> getPersonaBias() { return personaBias; }
        public void setPersonaBias(List<BiasDelta> personaBias) { this.personaBias = personaBias; }
    }

    public static class BiasDelta {
        private String dimension;
        private double delta;

        public BiasDelta() {}

        public BiasDelta(String dimension, double delta) {
            this.dimension = dimension;
            this.delta = delta;
        }

        public String getDimension() { return dimension; }
        public void setDimension(String dimension) { this.dimension = dimension; }
        public double getDelta() { return delta; }
        public void setDelta(double delta) { this.delta = delta; }
    }

    public static class CrisisEntry {
        private String strategy;
        private List<String> responses = new ArrayList<>();
        private String element;
        private String archetype;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public List<String> getResponses() { return responses; }
        public void setResponses(List<String> responses) { this.responses = responses; }
        public String getElement() { return element; }
        public void setElement(String element) { this.element = element; }
        public String getArchetype() { return archetype; }
        public void setArchetype(String archetype) { this.archetype = archetype; }
    }

    public static class Mastery {
        private boolean enabled = false;
        private double minTrust = 0.75;
        private Double minIntegration;
        private List<Jargon> jargon = new ArrayList<>();
        private int maxSentenceWords = 12;
        private int microSilenceInterval = 2;
        private String microSilenceMarker = "...";
        private List<String> closingLines = new ArrayList<>();
        private List<String> paradoxLines = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public double getMinTrust() { return minTrust; }
        public void setMinTrust(double minTrust) { this.minTrust = minTrust; }
        public Double getMinIntegration() { return minIntegration; }
        public void setMinIntegration(Double minIntegration) { this.minIntegration = minIntegration; }
        public List<Jargon> getJargon() { return jargon; }
        public void setJargon(List<Jargon> jargon) { this.jargon = jargon; }
        public int getMaxSentenceWords() { return maxSentenceWords; }
        public void setMaxSentenceWords(int maxSentenceWords) { this.maxSentenceWords = maxSentenceWords; }
        public int getMicroSilenceInterval() { return microSilenceInterval; }
        public void setMicroSilenceInterval(int microSilenceInterval) { this.microSilenceInterval = microSilenceInterval; }
        public String getMicroSilenceMarker() { return microSilenceMarker; }
        public void setMicroSilenceMarker(String microSilenceMarker) { this.microSilenceMarker = microSilenceMarker; }
        public List<String> getClosingLines() { return closingLines; }
        public void setClosingLines(List<String> closingLines) { this.closingLines = closingLines; }
        public List<String> getParadoxLines() { return paradoxLines; }
        public void setParadoxLines(List<String> paradoxLines) { this.paradoxLines = paradoxLines; }
    }

    public static class Jargon {
        private String term;
        private String plain;

        public Jargon() {}

        public Jargon(String term, String plain) {
            this.term = term;
            this.plain = plain;
        }

        public String getTerm() { return term; }
        public void setTerm(String term) { this.term = term; }
        public String getPlain() { return plain; }
        public void setPlain(String plain) { this.plain = plain; }
    }

    public static class FilterSet {
        private List<String> order = new ArrayList<>();
        private List<String> enabled = new ArrayList<>();

        public List<String> getOrder() { return order; }
        public void setOrder(List<String> order) { this.order = order; }
        public List<String> getEnabled() { return enabled; }
        public void setEnabled(List<String> enabled) { this.enabled = enabled; }
    }
}
