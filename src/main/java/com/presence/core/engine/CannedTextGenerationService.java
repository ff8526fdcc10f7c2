package com.presence.core.engine;

import com.presence.core.model.ResponseDirective;
import org.springframework.stereotype.Service;

/**
 * Default generator used when no real one is wired in: renders the override or onboarding
 * response from the directive, otherwise a fixed reflective line.
 */
@Service
public class CannedTextGenerationService implements TextGenerationService {

    static final String DEFAULT_REPLY = "I'm here with you. Tell me more about what is alive for you right now.";

    @Override
    public String generate(ResponseDirective directive, String userText) {
        if (directive.overrideActive() && directive.overrideResponse() != null) {
            return directive.overrideResponse();
        }
        if (directive.onboardingResponse() != null) {
            return directive.onboardingResponse();
        }
        return DEFAULT_REPLY;
    }
}
