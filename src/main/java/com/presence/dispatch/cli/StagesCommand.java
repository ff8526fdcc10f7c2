package com.presence.dispatch.cli;

import com.presence.core.stage.StageConfig;
import com.presence.core.stage.StageConfigRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: presence stages
 */
@Command(name = "stages", mixinStandardHelpOptions = true, description = "List configured stages")
@Component
public class StagesCommand implements Runnable {

    private final StageConfigRegistry registry;

    public StagesCommand(StageConfigRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        for (StageConfig stage : registry.all()) {
            String marker = stage.id().equals(registry.defaultStageId()) ? " (default)" : "";
            ConsoleOutput.success(stage.id() + marker + ": " + stage.displayName());
            ConsoleOutput.field("Mode", stage.orchestrationMode());
            ConsoleOutput.field("Voice", stage.voice().style() + ", " + stage.voice().pace());
            ConsoleOutput.field("Filters", String.join(" -> ", stage.filters().active()));
            stage.onboarding().ifPresent(o -> ConsoleOutput.field("Onboarding tones",
                    String.join(", ", o.tones().stream().map(StageConfig.ToneRule::tone).toList())));
            stage.mastery().ifPresent(m -> ConsoleOutput.field("Mastery voice",
                    (m.enabled() ? "enabled" : "disabled") + " (trust >= " + m.minTrust() + ")"));
        }
    }
}
