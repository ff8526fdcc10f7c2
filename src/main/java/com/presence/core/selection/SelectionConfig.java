package com.presence.core.selection;

import com.presence.core.stage.StageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link ResponseSelector} used for every canned-line choice,
 * picked by {@code presence.selection.strategy}.
 */
@Configuration
public class SelectionConfig {

    private static final Logger log = LoggerFactory.getLogger(SelectionConfig.class);

    @Bean
    @ConditionalOnMissingBean(ResponseSelector.class)
    public ResponseSelector responseSelector(StageProperties properties) {
        var selection = properties.getSelection();
        String strategy = selection.getStrategy() != null ? selection.getStrategy().trim().toLowerCase() : "hash";
        log.info("Response selection strategy: {} (seed {})", strategy, selection.getSeed());
        return switch (strategy) {
            case "hash" -> new HashResponseSelector(selection.getSeed());
            case "round-robin" -> new RoundRobinResponseSelector(selection.getSeed());
            default -> throw new IllegalStateException(
                    "Unknown presence.selection.strategy '" + selection.getStrategy()
                            + "' (expected hash or round-robin)");
        };
    }
}
