package com.sema.chat.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Chat orchestration metrics.
 */
public class ChatMetrics {

    private final MeterRegistry registry;

    // Timers
    private final Timer generationTimer;

    // Counters
    private final Counter messageCounter;
    private final Counter generationErrorCounter;
    private final Counter streamStartedCounter;
    private final Counter streamRejectedCounter;
    private final Counter streamAbortedCounter;
    private final Counter sessionClearedCounter;
    private final Counter backendSwitchCounter;
    private final Counter backendSwitchFailedCounter;

    public ChatMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.generationTimer = Timer.builder("chat.generation.duration")
                .description("Time spent in backend generation for complete responses")
                .tags("component", "backend")
                .register(registry);

        this.messageCounter = Counter.builder("chat.messages.total")
                .description("Total number of chat messages processed")
                .tags("operation", "message")
                .register(registry);

        this.generationErrorCounter = Counter.builder("chat.generation.errors")
                .description("Number of failed generations")
                .tags("operation", "message")
                .register(registry);

        this.streamStartedCounter = Counter.builder("chat.streams.started")
                .description("Number of streaming generations started")
                .tags("operation", "stream")
                .register(registry);

        this.streamRejectedCounter = Counter.builder("chat.streams.rejected")
                .description("Number of streams rejected at capacity")
                .tags("operation", "stream")
                .register(registry);

        this.streamAbortedCounter = Counter.builder("chat.streams.aborted")
                .description("Number of streams that ended without a final chunk")
                .tags("operation", "stream")
                .register(registry);

        this.sessionClearedCounter = Counter.builder("chat.sessions.cleared")
                .description("Number of sessions deleted on request")
                .tags("operation", "session")
                .register(registry);

        this.backendSwitchCounter = Counter.builder("chat.backend.switches")
                .description("Number of successful backend switches")
                .tags("component", "backend")
                .register(registry);

        this.backendSwitchFailedCounter = Counter.builder("chat.backend.switches.failed")
                .description("Number of backend switches rolled back")
                .tags("component", "backend")
                .register(registry);
    }

    public void bindActiveStreams(AtomicInteger activeStreams) {
        Gauge.builder("chat.streams.active", activeStreams, AtomicInteger::get)
                .description("Number of streaming generations in flight")
                .register(registry);
    }

    public void bindReadiness(Supplier<Boolean> ready) {
        Gauge.builder("chat.backend.ready", () -> Boolean.TRUE.equals(ready.get()) ? 1 : 0)
                .description("1 when the active backend is loaded")
                .register(registry);
    }

    public void recordMessageProcessed(Duration generationTime) {
        messageCounter.increment();
        if (generationTime != null) {
            generationTimer.record(generationTime);
        }
    }

    public void recordGenerationError() {
        generationErrorCounter.increment();
    }

    public void recordStreamStarted() {
        streamStartedCounter.increment();
    }

    public void recordStreamRejected() {
        streamRejectedCounter.increment();
    }

    public void recordStreamAborted() {
        streamAbortedCounter.increment();
    }

    public void recordSessionCleared() {
        sessionClearedCounter.increment();
    }

    public void recordBackendSwitch(boolean success) {
        if (success) {
            backendSwitchCounter.increment();
        } else {
            backendSwitchFailedCounter.increment();
        }
    }
}
