package com.presence.core.health;

import com.presence.core.memory.MemoryStoreWriter;
import com.presence.core.pattern.PatternRepository;
import com.presence.core.stage.StageConfigRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final StageConfigRegistry registry;
    private final PatternRepository patternRepository;
    private final MemoryStoreWriter memoryWriter;

    public HealthCheckService(StageConfigRegistry registry, PatternRepository patternRepository,
                              MemoryStoreWriter memoryWriter) {
        this.registry = registry;
        this.patternRepository = patternRepository;
        this.memoryWriter = memoryWriter;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStages());
        results.add(checkPatterns());
        results.add(checkMemoryStore());
        return results;
    }

    private HealthStatus checkStages() {
        if (registry.size() == 0) {
            return new HealthStatus("stages", HealthStatus.Status.DOWN, "No stages loaded", Map.of());
        }
        return new HealthStatus("stages", HealthStatus.Status.UP,
                registry.size() + " stages loaded",
                Map.of("default", registry.defaultStageId()));
    }

    private HealthStatus checkPatterns() {
        try {
            int users = patternRepository.userCount();
            return new HealthStatus("patterns", HealthStatus.Status.UP,
                    "Pattern repository available (" + patternRepository.getClass().getSimpleName() + ")",
                    Map.of("users", String.valueOf(users)));
        } catch (RuntimeException e) {
            log.warn("Pattern repository health check failed: {}", e.getMessage());
            return new HealthStatus("patterns", HealthStatus.Status.DOWN,
                    "Pattern repository error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkMemoryStore() {
        long failures = memoryWriter.failureCount();
        if (failures > 0) {
            return new HealthStatus("memory", HealthStatus.Status.DEGRADED,
                    failures + " memory store writes failed since startup",
                    Map.of("failures", String.valueOf(failures)));
        }
        return new HealthStatus("memory", HealthStatus.Status.UP, "Memory store writes healthy", Map.of());
    }
}
