package com.presence.core.engine;

import com.presence.core.model.ResponseDirective;

/**
 * Boundary to the natural-language generator that consumes a {@link ResponseDirective}.
 */
public interface TextGenerationService {

    String generate(ResponseDirective directive, String userText);
}
