package com.sema.chat.backend;

import com.sema.chat.exception.ModelLoadException;
import com.sema.chat.model.SupportedBackend;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup table from backend type to constructor. Adding a backend means adding one
 * registration; nothing else dispatches on the type string.
 */
@Slf4j
public class BackendRegistry {

    private final Map<String, BackendRegistration> registrations = new LinkedHashMap<>();

    public BackendRegistry register(BackendRegistration registration) {
        if (registrations.putIfAbsent(registration.type(), registration) != null) {
            throw new IllegalStateException("Backend type already registered: " + registration.type());
        }
        return this;
    }

    public Optional<BackendRegistration> find(String type) {
        return Optional.ofNullable(type == null ? null : registrations.get(type.toLowerCase()));
    }

    public boolean supports(String type) {
        return find(type).isPresent();
    }

    public List<SupportedBackend> supportedBackends() {
        return registrations.values().stream()
                .map(BackendRegistration::toSupportedBackend)
                .toList();
    }

    /**
     * Builds an unloaded backend after checking its prerequisites.
     *
     * @throws ModelLoadException for an unknown type or missing required settings
     */
    public ModelBackend create(String type, String modelName) {
        BackendRegistration registration = find(type).orElseThrow(() -> new ModelLoadException(
                "Unsupported backend type: " + type + ". Supported: " + registrations.keySet()));
        List<String> missing = registration.missingSettings().get();
        if (!missing.isEmpty()) {
            throw new ModelLoadException(
                    "Missing required settings for " + registration.type() + " backend: " + String.join(", ", missing));
        }
        log.debug("Creating {} backend for model {}", registration.type(), modelName);
        return registration.factory().apply(modelName);
    }
}
