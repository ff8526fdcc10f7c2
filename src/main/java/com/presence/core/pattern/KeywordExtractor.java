package com.presence.core.pattern;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives the keyword set of a message: lower-cased, punctuation stripped, split on whitespace,
 * stopwords and tokens of two characters or fewer dropped, de-duplicated in first-seen order.
 * Pure and repeatable for identical input.
 */
public final class KeywordExtractor {

    static final Set<String> STOPWORDS = Set.of(
            "the", "and", "but", "for", "with", "from", "this", "that", "these", "those",
            "they", "them", "their", "there", "then", "than", "are", "was", "were", "been",
            "being", "have", "has", "had", "does", "did", "will", "would", "could", "should",
            "can", "may", "might", "must", "shall", "not", "just", "very", "really", "about",
            "into", "onto", "over", "under", "again", "also", "some", "any", "all", "what",
            "when", "where", "which", "who", "whom", "why", "how", "you", "your", "yours",
            "she", "her", "his", "him", "its", "our", "ours", "myself", "yourself", "out",
            "because", "while", "much", "more", "most", "such", "only", "own", "same", "too",
            "feel", "feeling", "like", "know", "think", "get", "got", "keep", "way", "thing",
            "things", "still", "even", "dont", "cant", "ive", "im", "youre", "thats");

    private KeywordExtractor() {} // utility class

    public static List<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String cleaned = text.toLowerCase().replaceAll("[\\p{P}\\p{S}]", "");
        var keywords = new LinkedHashSet<String>();
        for (String token : cleaned.split("\\s+")) {
            if (token.length() > 2 && !STOPWORDS.contains(token)) {
                keywords.add(token);
            }
        }
        return List.copyOf(keywords);
    }
}
