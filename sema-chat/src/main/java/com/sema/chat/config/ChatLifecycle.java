package com.sema.chat.config;

import com.sema.chat.service.ModelManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * Loads the configured backend once the context is up and unloads it on shutdown.
 * A failed load is logged and leaves the service running without a ready backend.
 */
@Slf4j
@RequiredArgsConstructor
public class ChatLifecycle implements SmartLifecycle {

    private final ModelManager modelManager;
    private volatile boolean running;

    @Override
    public void start() {
        running = true;
        if (modelManager.initialize()) {
            log.info("Chat service started with backend {}", modelManager.getSelection());
        } else {
            log.error("Chat service started without a ready backend: {}", modelManager.getLastError());
        }
    }

    @Override
    public void stop() {
        log.info("Shutting down chat service");
        modelManager.shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
