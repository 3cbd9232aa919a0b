package com.sema.chat.service;

import com.sema.chat.backend.BackendRegistration;
import com.sema.chat.backend.BackendRegistry;
import com.sema.chat.backend.ScriptedBackend;
import com.sema.chat.exception.GenerationException;
import com.sema.chat.exception.ModelNotLoadedException;
import com.sema.chat.metrics.ChatMetrics;
import com.sema.chat.model.GenerationRequest;
import com.sema.chat.model.GenerationResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelManagerTest {

    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private BackendRegistry registry;
    private final Map<String, ScriptedBackend> built = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        meterRegistry = new SimpleMeterRegistry();
        registry = new BackendRegistry()
                .register(registration("alpha", model -> new ScriptedBackend("alpha", model, List.of("A"), executor)))
                .register(registration("beta", model -> new ScriptedBackend("beta", model, List.of("B"), executor)))
                .register(registration("offline", model -> new ScriptedBackend("offline", model, List.of("x"), executor)
                        .failingToLoad(new GenerationException("connection refused"))))
                .register(registration("flaky", model -> new ScriptedBackend("flaky", model, List.of("x"), executor)
                        .failingAfterLoad()))
                .register(new BackendRegistration("keyless", "Keyless", "Needs a key", List.of("keyless.api-key"),
                        Set.of("chat"), List.of(), () -> List.of("keyless.api-key"),
                        model -> new ScriptedBackend("keyless", model, List.of("k"), executor)));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private BackendRegistration registration(String type, Function<String, ScriptedBackend> factory) {
        return new BackendRegistration(type, type, type + " backend", List.of(), Set.of("chat"), List.of("m"),
                List::of, model -> {
                    ScriptedBackend backend = factory.apply(model);
                    built.put(type + ":" + model, backend);
                    return backend;
                });
    }

    private ModelManager manager(String type, String model) {
        return new ModelManager(registry, new BackendSelection(type, model), new ChatMetrics(meterRegistry));
    }

    @Nested
    @DisplayName("Initialization")
    class Initialization {

        @Test
        @DisplayName("Should load the configured backend")
        void shouldInitialize() {
            ModelManager manager = manager("alpha", "m1");

            assertThat(manager.initialize()).isTrue();
            assertThat(manager.isReady()).isTrue();
            assertThat(manager.getState()).isEqualTo(ManagerState.READY);
            assertThat(manager.getBackend().type()).isEqualTo("alpha");
            assertThat(manager.getModelInfo().backend().loaded()).isTrue();
        }

        @Test
        @DisplayName("Should record the failure and refuse traffic when loading fails")
        void shouldFailInitialization() {
            ModelManager manager = manager("offline", "m1");

            assertThat(manager.initialize()).isFalse();
            assertThat(manager.getState()).isEqualTo(ManagerState.FAILED);
            assertThat(manager.getLastError()).contains("connection refused");
            assertThatThrownBy(manager::getBackend)
                    .isInstanceOf(ModelNotLoadedException.class)
                    .hasMessageContaining("FAILED");
            assertThat(manager.health().reason()).isEqualTo("model_not_loaded");
        }

        @Test
        @DisplayName("Should name missing settings in the recorded error")
        void shouldReportMissingSettings() {
            ModelManager manager = manager("keyless", "m1");

            manager.initialize();

            assertThat(manager.getLastError()).contains("keyless.api-key");
        }
    }

    @Nested
    @DisplayName("Switching")
    class Switching {

        @Test
        @DisplayName("Should activate the new backend and release the old one")
        void shouldSwitch() {
            // Given
            ModelManager manager = manager("alpha", "m1");
            manager.initialize();

            // When
            SwitchResult result = manager.switchBackend("BETA", "m2");

            // Then
            assertThat(result.success()).isTrue();
            assertThat(result.active()).isEqualTo(new BackendSelection("beta", "m2"));
            assertThat(manager.getBackend().type()).isEqualTo("beta");
            assertThat(built.get("alpha:m1").isLoaded()).isFalse();
            assertThat(meterRegistry.counter("chat.backend.switches", "component", "backend").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should roll back to the previous backend when the target cannot load")
        void shouldRollBackOnLoadFailure() {
            // Given
            ModelManager manager = manager("alpha", "m1");
            manager.initialize();

            // When
            SwitchResult result = manager.switchBackend("offline", "m9");

            // Then
            assertThat(result.success()).isFalse();
            assertThat(result.message()).contains("connection refused").contains("restored alpha:m1");
            assertThat(result.active()).isEqualTo(new BackendSelection("alpha", "m1"));
            assertThat(manager.isReady()).isTrue();
            assertThat(manager.getSelection()).isEqualTo(new BackendSelection("alpha", "m1"));
            assertThat(manager.getLastError()).contains("connection refused");
        }

        @Test
        @DisplayName("Should roll back when the target loads but fails its health check")
        void shouldRollBackOnHealthFailure() {
            ModelManager manager = manager("alpha", "m1");
            manager.initialize();

            SwitchResult result = manager.switchBackend("flaky", "m3");

            assertThat(result.success()).isFalse();
            assertThat(result.message()).contains("health check failed");
            assertThat(manager.getBackend().type()).isEqualTo("alpha");
            assertThat(built.get("flaky:m3").isLoaded()).isFalse();
        }

        @Test
        @DisplayName("Should not report ready while the switched-in backend is still being health checked")
        void shouldStaySwitchingUntilHealthCheckPasses() {
            // Given
            AtomicReference<ModelManager> holder = new AtomicReference<>();
            List<ManagerState> statesDuringCheck = new CopyOnWriteArrayList<>();
            List<Boolean> readinessDuringCheck = new CopyOnWriteArrayList<>();
            registry.register(registration("watched", model -> new ScriptedBackend("watched", model, List.of("W"), executor) {
                @Override
                protected GenerationResult doGenerate(GenerationRequest request, String messageId) {
                    if (isLoaded()) {
                        statesDuringCheck.add(holder.get().getState());
                        readinessDuringCheck.add(holder.get().isReady());
                    }
                    return super.doGenerate(request, messageId);
                }
            }));
            ModelManager manager = manager("alpha", "m1");
            holder.set(manager);
            manager.initialize();

            // When
            SwitchResult result = manager.switchBackend("watched", "m4");

            // Then
            assertThat(result.success()).isTrue();
            assertThat(statesDuringCheck).containsExactly(ManagerState.SWITCHING);
            assertThat(readinessDuringCheck).containsExactly(false);
            assertThat(manager.getState()).isEqualTo(ManagerState.READY);
            assertThat(manager.getBackend().type()).isEqualTo("watched");
        }

        @Test
        @DisplayName("Should stay failed when there is no working backend to restore")
        void shouldNotRestoreBrokenPrevious() {
            ModelManager manager = manager("offline", "m1");
            manager.initialize();

            SwitchResult result = manager.switchBackend("offline", "m2");

            assertThat(result.success()).isFalse();
            assertThat(result.active()).isNull();
            assertThat(manager.isReady()).isFalse();
        }

        @Test
        @DisplayName("Should recover from a failed start by switching to a working backend")
        void shouldRecoverFromFailedStart() {
            ModelManager manager = manager("offline", "m1");
            manager.initialize();

            SwitchResult result = manager.switchBackend("alpha", "m1");

            assertThat(result.success()).isTrue();
            assertThat(manager.isReady()).isTrue();
            assertThat(manager.getLastError()).isNull();
        }

        @Test
        @DisplayName("Should reject a blank target without touching the active backend")
        void shouldRejectBlankTarget() {
            ModelManager manager = manager("alpha", "m1");
            manager.initialize();

            SwitchResult result = manager.switchBackend(" ", "m2");

            assertThat(result.success()).isFalse();
            assertThat(manager.getBackend().type()).isEqualTo("alpha");
        }
    }

    @Test
    @DisplayName("Should unload the backend on shutdown")
    void shouldShutdown() {
        ModelManager manager = manager("alpha", "m1");
        manager.initialize();

        manager.shutdown();

        assertThat(manager.isReady()).isFalse();
        assertThat(built.get("alpha:m1").unloadCount()).isEqualTo(1);
    }
}
