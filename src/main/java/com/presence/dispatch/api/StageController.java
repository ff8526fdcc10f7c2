package com.presence.dispatch.api;

import com.presence.core.stage.StageConfig;
import com.presence.core.stage.StageConfigRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller listing the configured relationship stages.
 */
@RestController
@RequestMapping("/api/v1/stages")
public class StageController {

    private final StageConfigRegistry registry;

    public StageController(StageConfigRegistry registry) {
        this.registry = registry;
    }

    /**
     * GET /api/v1/stages: Stage summaries plus the default stage id.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> stages() {
        List<Map<String, Object>> stages = registry.all().stream()
                .map(StageController::summarize)
                .toList();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("default_stage", registry.defaultStageId());
        result.put("stages", stages);
        return ResponseEntity.ok(result);
    }

    private static Map<String, Object> summarize(StageConfig stage) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", stage.id());
        summary.put("display_name", stage.displayName());
        summary.put("orchestration_mode", stage.orchestrationMode());
        summary.put("onboarding", stage.onboarding().isPresent());
        summary.put("mastery_voice", stage.mastery().map(StageConfig.MasteryVoiceBlock::enabled).orElse(false));
        summary.put("active_filters", stage.filters().active());
        return summary;
    }
}
