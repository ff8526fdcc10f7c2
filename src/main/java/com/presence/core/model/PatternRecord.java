package com.presence.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * One tracked turn. Append-only: records are never mutated once created.
 *
 * @param userId     owner of the record
 * @param timestamp  when the turn was tracked
 * @param focalPoint lens the turn addressed
 * @param element    element tag supplied by the caller (e.g. "water"); nullable
 * @param confidence focal point confidence, 0.5..1.0
 * @param keywords   keywords extracted from the input, de-duplicated in first-seen order
 * @param resolution how the turn relates to earlier turns
 */
public record PatternRecord(
    String userId,
    Instant timestamp,
    FocalPoint focalPoint,
    String element,
    double confidence,
    List<String> keywords,
    Resolution resolution
) implements Serializable {

    public PatternRecord {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    /** Order-independent signature of the keyword set, used for stuck point and cycling detection. */
    public String signature() {
        return keywords.stream().sorted().reduce((a, b) -> a + "," + b).orElse("");
    }
}
