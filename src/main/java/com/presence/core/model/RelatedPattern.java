package com.presence.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * An earlier record sharing at least two keywords with the current input.
 */
public record RelatedPattern(
    FocalPoint focalPoint,
    String element,
    List<String> overlap
) implements Serializable {

    /** Formats as {@code focal/element/kw1+kw2}. */
    public String reference() {
        return focalPoint.key() + "/" + (element != null ? element : "-") + "/" + String.join("+", overlap);
    }
}
