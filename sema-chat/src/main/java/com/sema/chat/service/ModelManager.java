package com.sema.chat.service;

import com.sema.chat.backend.BackendRegistry;
import com.sema.chat.backend.ModelBackend;
import com.sema.chat.exception.ModelNotLoadedException;
import com.sema.chat.metrics.ChatMetrics;
import com.sema.chat.model.BackendHealth;
import com.sema.chat.model.SupportedBackend;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single active backend. Lifecycle transitions are serialized; readers
 * see the active backend through a volatile reference and never block.
 */
@Slf4j
public class ModelManager {

    private final BackendRegistry registry;
    private final ChatMetrics metrics;
    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private volatile ManagerState state = ManagerState.UNINITIALIZED;
    private volatile ModelBackend activeBackend;
    private volatile BackendSelection selection;
    private volatile String lastError;

    public ModelManager(BackendRegistry registry, BackendSelection initialSelection, ChatMetrics metrics) {
        this.registry = registry;
        this.selection = initialSelection;
        this.metrics = metrics;
        metrics.bindReadiness(this::isReady);
    }

    /**
     * Builds and loads the configured backend. A failure leaves the manager
     * {@link ManagerState#FAILED} with {@link #getLastError()} set.
     */
    public boolean initialize() {
        lifecycleLock.lock();
        try {
            if (state == ManagerState.READY && activeBackend != null) {
                return true;
            }
            log.info("Initializing model backend {}", selection);
            return activate(selection, ManagerState.INITIALIZING, false);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Replaces the active backend. The new backend must load and pass a health
     * check; otherwise the previous selection is re-initialized. Never throws.
     */
    public SwitchResult switchBackend(String type, String modelName) {
        if (type == null || type.isBlank() || modelName == null || modelName.isBlank()) {
            return SwitchResult.failed(selection, "Backend type and model name are required");
        }
        BackendSelection target = new BackendSelection(type.toLowerCase(), modelName);
        lifecycleLock.lock();
        try {
            BackendSelection previous = selection;
            boolean previousWorked = state == ManagerState.READY;
            log.info("Switching model backend from {} to {}", previous, target);

            state = ManagerState.SWITCHING;
            ModelBackend old = activeBackend;
            activeBackend = null;
            if (old != null && !old.unload()) {
                log.warn("Previous backend {} did not release cleanly", previous);
            }

            if (activate(target, ManagerState.SWITCHING, true)) {
                metrics.recordBackendSwitch(true);
                return SwitchResult.succeeded(target, "Switched to " + target);
            }

            String failure = lastError;
            metrics.recordBackendSwitch(false);
            if (previous == null || !previousWorked) {
                log.warn("Switch to {} failed and no previously working backend to restore: {}", target, failure);
                return SwitchResult.failed(null, "Failed to switch to " + target + ": " + failure);
            }

            log.warn("Switch to {} failed ({}), rolling back to {}", target, failure, previous);
            boolean restored = activate(previous, ManagerState.SWITCHING, false);
            lastError = failure;
            String message = "Failed to switch to " + target + ": " + failure
                    + (restored ? "; restored " + previous : "; could not restore " + previous);
            return SwitchResult.failed(restored ? previous : null, message);
        } finally {
            lifecycleLock.unlock();
        }
    }

    public boolean isReady() {
        ModelBackend backend = activeBackend;
        return state == ManagerState.READY && backend != null && backend.isLoaded();
    }

    /**
     * @throws ModelNotLoadedException if no backend is ready
     */
    public ModelBackend getBackend() {
        ModelBackend backend = activeBackend;
        if (backend == null || !isReady()) {
            throw new ModelNotLoadedException("Model backend is not ready (state: " + state + ")");
        }
        return backend;
    }

    public ModelInfo getModelInfo() {
        ModelBackend backend = activeBackend;
        BackendSelection current = selection;
        return new ModelInfo(
                current == null ? null : current.type(),
                current == null ? null : current.modelName(),
                state,
                isReady(),
                backend == null ? null : backend.describe(),
                lastError);
    }

    public BackendHealth health() {
        ModelBackend backend = activeBackend;
        if (backend == null || !isReady()) {
            return BackendHealth.unhealthy(selection == null ? null : selection.modelName(), "model_not_loaded");
        }
        return backend.health();
    }

    public List<SupportedBackend> supportedBackends() {
        return registry.supportedBackends();
    }

    public void shutdown() {
        lifecycleLock.lock();
        try {
            ModelBackend backend = activeBackend;
            activeBackend = null;
            state = ManagerState.UNINITIALIZED;
            if (backend != null) {
                log.info("Shutting down model backend {}", selection);
                backend.unload();
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    public ManagerState getState() {
        return state;
    }

    public BackendSelection getSelection() {
        return selection;
    }

    public String getLastError() {
        return lastError;
    }

    /**
     * Loads {@code target} while the manager reports {@code pending}; the backend is
     * published and the state becomes READY only after load, and the health check when
     * {@code healthChecked} is set, succeed.
     */
    private boolean activate(BackendSelection target, ManagerState pending, boolean healthChecked) {
        state = pending;
        ModelBackend backend;
        try {
            backend = registry.create(target.type(), target.modelName());
            backend.load();
        } catch (RuntimeException e) {
            activeBackend = null;
            lastError = e.getMessage();
            state = ManagerState.FAILED;
            log.error("Failed to initialize model backend {}: {}", target, e.getMessage());
            return false;
        }
        if (healthChecked && !passesHealthCheck(target, backend)) {
            return false;
        }
        activeBackend = backend;
        selection = target;
        lastError = null;
        state = ManagerState.READY;
        log.info("Model backend {} is ready", target);
        return true;
    }

    private boolean passesHealthCheck(BackendSelection target, ModelBackend backend) {
        BackendHealth health = backend.health();
        if (health.isHealthy()) {
            return true;
        }
        log.warn("Backend {} failed its health check: {}", target, health.reason());
        backend.unload();
        activeBackend = null;
        lastError = "health check failed: " + health.reason();
        state = ManagerState.FAILED;
        return false;
    }
}
