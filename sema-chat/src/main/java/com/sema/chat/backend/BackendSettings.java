package com.sema.chat.backend;

import com.sema.chat.model.GenerationParameters;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Settings shared by every backend variant.
 *
 * @param streamExecutor runs streaming producers for network backends
 */
public record BackendSettings(
        String modelName,
        GenerationParameters defaults,
        Duration requestTimeout,
        Duration healthTimeout,
        Duration streamDelay,
        int channelCapacity,
        ExecutorService streamExecutor
) {
}
