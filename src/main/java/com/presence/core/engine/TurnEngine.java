package com.presence.core.engine;

import com.presence.core.crisis.CrisisDetector;
import com.presence.core.events.EventBus;
import com.presence.core.events.PresenceEvent;
import com.presence.core.filter.FilterContext;
import com.presence.core.filter.ResponseFilterPipeline;
import com.presence.core.logging.MdcContext;
import com.presence.core.mastery.MasteryVoiceProcessor;
import com.presence.core.memory.MemoryStoreWriter;
import com.presence.core.metrics.PresenceMetrics;
import com.presence.core.model.CrisisLevel;
import com.presence.core.model.PersonaState;
import com.presence.core.model.ProfileSummary;
import com.presence.core.model.ResponseDirective;
import com.presence.core.model.TrackingResult;
import com.presence.core.pattern.PatternTracker;
import com.presence.core.persona.PersonaStateStore;
import com.presence.core.stage.StageConfig;
import com.presence.core.stage.StageConfigRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs one conversational turn through the decision layer.
 * <p>
 * {@link #evaluate(TurnRequest)} classifies crisis level before anything else, resolves the stage,
 * runs the stage's filters and attaches longitudinal guidance. {@link #complete(TurnCompletion)}
 * shapes generated text and hands the turn to the pattern tracker and memory store on background
 * threads, so neither can stall the turn. Tracking for one user is queued behind that user's previous
 * tracking task, so history is appended in completion order.
 */
@Service
public class TurnEngine {

    private static final Logger log = LoggerFactory.getLogger(TurnEngine.class);

    private final StageConfigRegistry registry;
    private final ResponseFilterPipeline pipeline;
    private final MasteryVoiceProcessor masteryVoice;
    private final PatternTracker tracker;
    private final PersonaStateStore personaStore;
    private final MemoryStoreWriter memoryWriter;
    private final TextGenerationService generator;
    private final EventBus eventBus;
    private final PresenceMetrics metrics;
    private final ExecutorService trackingExecutor;
    private final ConcurrentHashMap<String, CompletableFuture<?>> trackingTails = new ConcurrentHashMap<>();

    public TurnEngine(StageConfigRegistry registry, ResponseFilterPipeline pipeline,
                      MasteryVoiceProcessor masteryVoice, PatternTracker tracker, PersonaStateStore personaStore,
                      MemoryStoreWriter memoryWriter, TextGenerationService generator, EventBus eventBus,
                      PresenceMetrics metrics) {
        this.registry = registry;
        this.pipeline = pipeline;
        this.masteryVoice = masteryVoice;
        this.tracker = tracker;
        this.personaStore = personaStore;
        this.memoryWriter = memoryWriter;
        this.generator = generator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        var threadCount = new AtomicInteger();
        this.trackingExecutor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "pattern-tracker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Produces the directive for one turn.
     *
     * @throws IllegalArgumentException if the user id is missing
     */
    public ResponseDirective evaluate(TurnRequest request) {
        requireUser(request.userId());
        String turnId = generateTurnId();
        long start = System.currentTimeMillis();
        MdcContext.setTurn(request.userId(), request.stageId(), turnId);
        try {
            String text = request.text() != null ? request.text() : "";
            CrisisLevel crisisLevel = CrisisDetector.detect(text);
            metrics.recordCrisisDetection(crisisLevel);

            StageConfig stage = registry.get(request.stageId());
            PersonaState persona = request.persona() != null
                    ? request.persona()
                    : personaStore.get(request.userId());

            ResponseDirective directive = pipeline.run(stage,
                    new FilterContext(request.userId(), text, stage, crisisLevel, persona));

            if (!directive.personaBiasDeltas().isEmpty()) {
                PersonaState updated = personaStore.applyDeltas(request.userId(), directive.personaBiasDeltas());
                log.debug("Persona for user {} is now {}", request.userId(), updated);
            }

            if (crisisLevel != CrisisLevel.GREEN) {
                eventBus.publish(PresenceEvent.of(PresenceEvent.CRISIS_DETECTED, request.userId(), stage.id(),
                        Map.of("level", crisisLevel.key(), "strategy", directive.strategy().name().toLowerCase())));
            }

            if (!directive.overrideActive()) {
                ProfileSummary summary = tracker.summary(request.userId());
                directive = directive.withGuidance(summary.insights(), summary.recommendations());
            }

            long elapsed = System.currentTimeMillis() - start;
            metrics.recordTurn(directive.strategy(), elapsed);
            log.info("Turn {} evaluated on stage {}: crisis={}, override={}, tone={}, filters={} ({}ms)",
                    turnId, stage.id(), crisisLevel.key(), directive.overrideActive(), directive.toneTag(),
                    directive.executedFilters(), elapsed);
            eventBus.publish(PresenceEvent.of(PresenceEvent.TURN_EVALUATED, request.userId(), stage.id(), Map.of(
                    "turnId", turnId,
                    "crisisLevel", crisisLevel.key(),
                    "overrideActive", directive.overrideActive())));
            return directive;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Applies the mastery voice to generated text and schedules tracking and the memory write.
     */
    public CompletedTurn complete(TurnCompletion completion) {
        requireUser(completion.userId());
        String userId = completion.userId();
        StageConfig stage = registry.get(completion.stageId());
        PersonaState persona = completion.persona() != null
                ? completion.persona()
                : personaStore.get(userId);

        boolean masteryActive = MasteryVoiceProcessor.isActive(stage, persona);
        String text = masteryVoice.apply(completion.generatedText(), stage, persona);
        if (stage.mastery().isPresent()) {
            metrics.recordMasteryVoice(masteryActive);
        }

        CompletableFuture<TrackingResult> tracking = enqueueTracking(userId, () -> {
            MdcContext.setUser(userId);
            try {
                return tracker.track(userId, completion.text(), completion.focalPoint(), completion.element(), text);
            } finally {
                MdcContext.clear();
            }
        });
        tracking.whenComplete((result, error) -> {
            if (error != null) {
                log.warn("Pattern tracking failed for user {}: {}", userId, error.getMessage(), error);
            }
        });

        var payload = new HashMap<String, Object>();
        payload.put("stageId", stage.id());
        payload.put("input", completion.text() != null ? completion.text() : "");
        payload.put("response", text != null ? text : "");
        if (completion.focalPoint() != null) {
            payload.put("focalPoint", completion.focalPoint().key());
        }
        CompletableFuture<Boolean> storeWrite = memoryWriter.write(userId, "turn", payload);

        return new CompletedTurn(text, masteryActive, tracking, storeWrite);
    }

    /**
     * Evaluates, generates through the configured {@link TextGenerationService} and completes one turn.
     */
    public ConversationTurn converse(TurnRequest request) {
        ResponseDirective directive = evaluate(request);
        String generated = generator.generate(directive, request.text());
        CompletedTurn completed = complete(new TurnCompletion(
                request.userId(), directive.stageId(), request.text(), generated, null, directive.forcedElement(),
                request.persona()));
        return new ConversationTurn(directive, generated, completed);
    }

    public ProfileSummary profile(String userId) {
        requireUser(userId);
        return tracker.summary(userId);
    }

    /**
     * Runs the task after every tracking task already queued for the user, whether those succeeded or not.
     */
    private <T> CompletableFuture<T> enqueueTracking(String userId, Supplier<T> task) {
        var queued = new AtomicReference<CompletableFuture<T>>();
        trackingTails.compute(userId, (key, tail) -> {
            CompletableFuture<?> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
            CompletableFuture<T> next = previous
                    .handle((result, error) -> null)
                    .thenApplyAsync(ignored -> task.get(), trackingExecutor);
            queued.set(next);
            return next;
        });
        CompletableFuture<T> next = queued.get();
        next.whenComplete((result, error) -> trackingTails.remove(userId, next));
        return next;
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
    }

    private static String generateTurnId() {
        return "turn-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @PreDestroy
    void shutdown() {
        trackingExecutor.shutdown();
        try {
            if (!trackingExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                trackingExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            trackingExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Pattern tracking executor stopped");
    }
}
