package com.presence.core.mastery;

import com.presence.core.model.PersonaState;
import com.presence.core.selection.ResponseSelector;
import com.presence.core.stage.StageConfig;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shapes generated text into the terse, jargon-free mastery voice.
 * <p>
 * Active only when the stage's mastery block is enabled and the persona clears the trust
 * threshold (and the integration threshold, when one is declared). When active the steps
 * run in this order:
 * <ol>
 *   <li>jargon terms are replaced by their plain equivalents (whole words, case-insensitive)</li>
 *   <li>if a sentence states a duality, the sentences after it are dropped and one paradox line
 *       is appended instead</li>
 *   <li>each sentence longer than the word cap keeps its first N words and ends in "..."</li>
 *   <li>the micro-silence marker is placed after every N-th sentence except the last</li>
 *   <li>one closing line is appended after a blank line</li>
 * </ol>
 * Line choices go through the configured {@link ResponseSelector}, so output is deterministic.
 */
@Service
public class MasteryVoiceProcessor {

    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern DUALITY = Pattern.compile(
            "\\b(both|paradox(ical)?|contradict(ion|ory|s)?|on the other hand|at the same time|and yet)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final String TRUNCATION = "...";

    private final ResponseSelector selector;

    public MasteryVoiceProcessor(ResponseSelector selector) {
        this.selector = selector;
    }

    public static boolean isActive(StageConfig stage, PersonaState persona) {
        if (stage == null || persona == null) {
            return false;
        }
        return stage.mastery()
                .filter(StageConfig.MasteryVoiceBlock::enabled)
                .filter(block -> persona.trust() >= block.minTrust())
                .filter(block -> block.minIntegration() == null || persona.integration() >= block.minIntegration())
                .isPresent();
    }

    /**
     * @return the shaped text, or {@code generatedText} unchanged when the mastery voice is not active
     */
    public String apply(String generatedText, StageConfig stage, PersonaState persona) {
        if (generatedText == null || generatedText.isBlank() || !isActive(stage, persona)) {
            return generatedText;
        }
        StageConfig.MasteryVoiceBlock block = stage.masteryBlock();

        String plain = replaceJargon(generatedText.trim(), block.jargon());
        List<String> sentences = splitSentences(plain);
        sentences = distillParadox(sentences, block.paradoxLines(), plain);
        sentences = sentences.stream()
                .map(s -> capSentence(s, block.maxSentenceWords()))
                .toList();

        String body = insertMicroSilences(sentences, block.microSilenceInterval(), block.microSilenceMarker());
        return selector.select(block.closingLines(), body)
                .map(closing -> body + "\n\n" + closing)
                .orElse(body);
    }

    static String replaceJargon(String text, List<StageConfig.JargonRule> jargon) {
        String result = text;
        for (var rule : jargon) {
            if (rule.term() == null || rule.term().isBlank()) {
                continue;
            }
            Matcher m = Pattern.compile("\\b" + Pattern.quote(rule.term()) + "\\b", Pattern.CASE_INSENSITIVE)
                    .matcher(result);
            var sb = new StringBuilder();
            while (m.find()) {
                String replacement = Character.isUpperCase(m.group().charAt(0))
                        ? capitalize(rule.plain())
                        : rule.plain();
                m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
            }
            m.appendTail(sb);
            result = sb.toString();
        }
        return result;
    }

    static List<String> splitSentences(String text) {
        return Arrays.stream(SENTENCE_BREAK.split(text))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private List<String> distillParadox(List<String> sentences, List<String> paradoxLines, String key) {
        if (paradoxLines.isEmpty()) {
            return sentences;
        }
        for (int i = 0; i < sentences.size(); i++) {
            if (DUALITY.matcher(sentences.get(i)).find()) {
                var kept = new ArrayList<>(sentences.subList(0, i + 1));
                selector.select(paradoxLines, key).ifPresent(kept::add);
                return kept;
            }
        }
        return sentences;
    }

    static String capSentence(String sentence, int maxWords) {
        String[] words = sentence.split("\\s+");
        if (words.length <= maxWords) {
            return sentence;
        }
        String head = String.join(" ", Arrays.copyOfRange(words, 0, maxWords));
        return head.replaceAll("[,;:.!?]+$", "") + TRUNCATION;
    }

    static String insertMicroSilences(List<String> sentences, int interval, String marker) {
        var sb = new StringBuilder();
        for (int i = 0; i < sentences.size(); i++) {
            sb.append(sentences.get(i));
            boolean last = i == sentences.size() - 1;
            if (!last) {
                sb.append((i + 1) % interval == 0 ? " " + marker + " " : " ");
            }
        }
        return sb.toString();
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
