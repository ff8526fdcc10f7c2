package com.presence.dispatch.cli;

import com.presence.core.engine.ConversationTurn;
import com.presence.core.engine.TurnEngine;
import com.presence.core.engine.TurnRequest;
import com.presence.core.model.ResponseDirective;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: presence evaluate [--user id] [--stage id] [--converse] &lt;text&gt;
 * <p>
 * Evaluates one message and prints the resulting directive. With {@code --converse} the
 * turn is also generated and completed, and the final text is printed.
 */
@Command(name = "evaluate", mixinStandardHelpOptions = true, description = "Evaluate a message and print its directive")
@Component
public class EvaluateCommand implements Runnable {

    @Parameters(arity = "1..*", description = "Message text")
    private List<String> words;

    @Option(names = {"--user", "-u"}, description = "User id (default: ${DEFAULT-VALUE})", defaultValue = "cli-user")
    private String userId;

    @Option(names = {"--stage", "-s"}, description = "Stage id (default: configured default stage)")
    private String stageId;

    @Option(names = {"--converse", "-c"}, description = "Also generate and post-process a reply")
    private boolean converse;

    private final TurnEngine turnEngine;

    public EvaluateCommand(TurnEngine turnEngine) {
        this.turnEngine = turnEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        String text = String.join(" ", words);
        var request = new TurnRequest(userId, text, stageId);

        ResponseDirective directive;
        String reply = null;
        if (converse) {
            ConversationTurn turn = turnEngine.converse(request);
            directive = turn.directive();
            reply = turn.completed().text();
            turn.completed().tracking().join();
        } else {
            directive = turnEngine.evaluate(request);
        }
        print(directive);
        if (reply != null) {
            System.out.println();
            ConsoleOutput.info("Reply:");
            System.out.println(reply);
        }
    }

    static void print(ResponseDirective directive) {
        ConsoleOutput.crisis(directive.crisisLevel().key(), directive.strategy().name().toLowerCase());
        ConsoleOutput.field("Stage", directive.stageId());
        if (directive.overrideActive()) {
            ConsoleOutput.field("Override", directive.overrideResponse());
            if (directive.forcedElement() != null) {
                ConsoleOutput.field("Forced", directive.forcedElement() + " / " + directive.forcedArchetype());
            }
        }
        if (directive.toneTag() != null) {
            ConsoleOutput.field("Tone", directive.toneTag());
        }
        if (directive.onboardingResponse() != null) {
            ConsoleOutput.field("Onboarding", directive.onboardingResponse());
        }
        if (!directive.personaBiasDeltas().isEmpty()) {
            ConsoleOutput.field("Persona bias", directive.personaBiasDeltas());
        }
        ConsoleOutput.field("Filters", String.join(", ", directive.executedFilters()));
        if (!directive.templateHints().isEmpty()) {
            ConsoleOutput.field("Hints", String.join(", ", directive.templateHints()));
        }
        ConsoleOutput.field("Mastery voice", directive.masteryVoiceActive());
        if (!directive.insights().isEmpty()) {
            ConsoleOutput.field("Insights", "");
            directive.insights().forEach(ConsoleOutput::bullet);
        }
        if (!directive.recommendations().isEmpty()) {
            ConsoleOutput.field("Recommendations", "");
            directive.recommendations().forEach(ConsoleOutput::bullet);
        }
    }
}
