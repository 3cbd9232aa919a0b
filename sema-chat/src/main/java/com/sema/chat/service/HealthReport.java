package com.sema.chat.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.sema.chat.model.BackendHealth;

import java.time.Instant;

/**
 * Composite health: backend readiness plus session store reachability.
 *
 * @param status {@code healthy}, {@code degraded} or {@code unhealthy}
 */
public record HealthReport(
        String status,
        boolean modelReady,
        BackendHealth backend,
        String storageType,
        boolean storageReachable,
        int activeStreams,
        int maxConcurrentStreams,
        Instant timestamp
) {
    @JsonIgnore
    public boolean isHealthy() {
        return "healthy".equals(status);
    }
}
