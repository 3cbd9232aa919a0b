package com.sema.chat.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;

public record BackendHealth(
        HealthStatus status,
        String reason,
        String modelName,
        Duration responseTime
) {
    public static BackendHealth healthy(String modelName, Duration responseTime) {
        return new BackendHealth(HealthStatus.HEALTHY, null, modelName, responseTime);
    }

    public static BackendHealth unhealthy(String modelName, String reason) {
        return new BackendHealth(HealthStatus.UNHEALTHY, reason, modelName, null);
    }

    public static BackendHealth timeout(String modelName) {
        return new BackendHealth(HealthStatus.TIMEOUT, "timeout", modelName, null);
    }

    @JsonIgnore
    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
