package com.presence.core.metrics;

import com.presence.core.model.CrisisLevel;
import com.presence.core.model.OverrideStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for turn evaluation and pattern tracking.
 */
@Service
public class PresenceMetrics {

    private final MeterRegistry registry;

    public PresenceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCrisisDetection(CrisisLevel level) {
        Counter.builder("presence.crisis.detections")
                .tag("level", level.key())
                .register(registry)
                .increment();
    }

    public void recordTurn(OverrideStrategy strategy, long ms) {
        Counter.builder("presence.turns.total")
                .tag("strategy", strategy.name().toLowerCase())
                .register(registry)
                .increment();
        Timer.builder("presence.turn.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordFilterExecution(String filterName) {
        Counter.builder("presence.filters.executed")
                .tag("filter", filterName)
                .register(registry)
                .increment();
    }

    /**
     * Records a configured filter name that resolved to a pass-through placeholder.
     */
    public void recordPlaceholderFilter(String filterName) {
        Counter.builder("presence.filters.placeholder")
                .description("Declared filters with no concrete handler")
                .tag("filter", filterName)
                .register(registry)
                .increment();
    }

    public void recordMasteryVoice(boolean active) {
        Counter.builder("presence.mastery.applied")
                .tag("active", String.valueOf(active))
                .register(registry)
                .increment();
    }

    public void recordPatternConfidence(double confidence) {
        DistributionSummary.builder("presence.pattern.confidence")
                .register(registry)
                .record(confidence);
    }

    public void incrementStoreFailures(String kind) {
        Counter.builder("presence.store.failures")
                .description("Memory store writes that failed or timed out")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public double storeFailureCount() {
        return registry.find("presence.store.failures").counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }
}
