package com.presence.dispatch.api;

import com.presence.core.engine.CompletedTurn;
import com.presence.core.engine.ConversationTurn;
import com.presence.core.engine.TurnCompletion;
import com.presence.core.engine.TurnEngine;
import com.presence.core.engine.TurnRequest;
import com.presence.core.model.FocalPoint;
import com.presence.core.model.ResponseDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for turn evaluation and completion.
 */
@RestController
@RequestMapping("/api/v1/turns")
public class TurnController {

    private static final Logger log = LoggerFactory.getLogger(TurnController.class);

    private final TurnEngine turnEngine;

    public TurnController(TurnEngine turnEngine) {
        this.turnEngine = turnEngine;
    }

    /**
     * POST /api/v1/turns: Evaluate a turn and return its directive.
     * With {@code "converse": true} the turn is also generated and completed.
     */
    @PostMapping
    public ResponseEntity<?> evaluate(@RequestBody TurnRequestBody body) {
        if (body.userId() == null || body.userId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "user_id is required"));
        }
        if (body.text() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "text is required"));
        }

        var request = new TurnRequest(body.userId(), body.text(), body.stageId(), body.persona());
        if (Boolean.TRUE.equals(body.converse())) {
            ConversationTurn turn = turnEngine.converse(request);
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("directive", turn.directive());
            result.put("text", turn.completed().text());
            result.put("mastery_applied", turn.completed().masteryApplied());
            return ResponseEntity.ok(result);
        }
        ResponseDirective directive = turnEngine.evaluate(request);
        return ResponseEntity.ok(directive);
    }

    /**
     * POST /api/v1/turns/complete: Post-process generated text and schedule tracking.
     */
    @PostMapping("/complete")
    public ResponseEntity<Map<String, Object>> complete(@RequestBody CompleteTurnRequest body) {
        if (body.userId() == null || body.userId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "user_id is required"));
        }
        if (body.generatedText() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "generated_text is required"));
        }
        FocalPoint focalPoint = FocalPoint.fromKey(body.focalPoint());
        if (body.focalPoint() != null && !body.focalPoint().isBlank() && focalPoint == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid focal_point: " + body.focalPoint()));
        }

        CompletedTurn completed = turnEngine.complete(new TurnCompletion(
                body.userId(), body.stageId(), body.text(), body.generatedText(), focalPoint, body.element(),
                body.persona()));
        log.debug("Completed turn for user {} (mastery={})", body.userId(), completed.masteryApplied());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("text", completed.text());
        result.put("mastery_applied", completed.masteryApplied());
        return ResponseEntity.ok(result);
    }
}
