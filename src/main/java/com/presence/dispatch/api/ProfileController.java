package com.presence.dispatch.api;

import com.presence.core.engine.TurnEngine;
import com.presence.core.model.ProfileSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for longitudinal user profiles.
 */
@RestController
@RequestMapping("/api/v1/profiles")
public class ProfileController {

    private final TurnEngine turnEngine;

    public ProfileController(TurnEngine turnEngine) {
        this.turnEngine = turnEngine;
    }

    /**
     * GET /api/v1/profiles/{userId}: Profile, insights and recommendations. Read-only.
     */
    @GetMapping("/{userId}")
    public ResponseEntity<ProfileSummary> profile(@PathVariable String userId) {
        return ResponseEntity.ok(turnEngine.profile(userId));
    }
}
