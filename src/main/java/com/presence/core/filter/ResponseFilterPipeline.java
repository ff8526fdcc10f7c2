package com.presence.core.filter;

import com.presence.core.metrics.PresenceMetrics;
import com.presence.core.model.ResponseDirective;
import com.presence.core.stage.StageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a stage's active filters in declared order, accumulating one {@link ResponseDirective}.
 * <p>
 * The crisis override filter always runs first, whether or not the stage declares it.
 * The first filter that returns {@link FilterOutcome#TERMINATE} ends the run. Names with
 * no handler are registered placeholders (the registry rejects anything else at startup)
 * and execute as logged no-ops.
 */
@Service
public class ResponseFilterPipeline {

    private static final Logger log = LoggerFactory.getLogger(ResponseFilterPipeline.class);

    private final Map<String, ResponseFilter> filters = new LinkedHashMap<>();
    private final ResponseFilter crisisFilter;
    private final PresenceMetrics metrics;

    public ResponseFilterPipeline(List<ResponseFilter> filters, PresenceMetrics metrics) {
        for (ResponseFilter filter : filters) {
            ResponseFilter previous = this.filters.put(filter.name(), filter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate response filter name: " + filter.name());
            }
        }
        this.crisisFilter = this.filters.get(CrisisOverrideFilter.NAME);
        if (crisisFilter == null) {
            throw new IllegalStateException("No '" + CrisisOverrideFilter.NAME + "' filter registered");
        }
        this.metrics = metrics;
    }

    public ResponseDirective run(StageConfig stage, FilterContext context) {
        var directive = new DirectiveBuilder();

        if (execute(crisisFilter, context, directive) == FilterOutcome.TERMINATE) {
            return directive.build(stage.id(), context.crisisLevel());
        }

        for (String name : stage.filters().active()) {
            if (CrisisOverrideFilter.NAME.equals(name)) {
                continue;
            }
            ResponseFilter filter = filters.get(name);
            if (filter == null) {
                log.debug("Filter '{}' on stage {} is a placeholder, skipping", name, stage.id());
                metrics.recordPlaceholderFilter(name);
                continue;
            }
            if (execute(filter, context, directive) == FilterOutcome.TERMINATE) {
                log.debug("Filter '{}' terminated the pipeline on stage {}", name, stage.id());
                break;
            }
        }
        return directive.build(stage.id(), context.crisisLevel());
    }

    private FilterOutcome execute(ResponseFilter filter, FilterContext context, DirectiveBuilder directive) {
        FilterOutcome outcome = filter.apply(context, directive);
        directive.executed(filter.name());
        metrics.recordFilterExecution(filter.name());
        log.debug("Filter '{}' -> {}", filter.name(), outcome);
        return outcome;
    }
}
