package com.sema.chat.backend;

import com.sema.chat.model.SupportedBackend;

import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One entry in the {@link BackendRegistry}.
 *
 * @param missingSettings names of required settings that are currently unset
 * @param factory         builds an unloaded backend for a model name
 */
public record BackendRegistration(
        String type,
        String name,
        String description,
        List<String> requires,
        Set<String> capabilities,
        List<String> exampleModels,
        Supplier<List<String>> missingSettings,
        Function<String, ModelBackend> factory
) {
    public BackendRegistration {
        requires = List.copyOf(requires);
        capabilities = Set.copyOf(capabilities);
        exampleModels = List.copyOf(exampleModels);
        missingSettings = missingSettings == null ? List::of : missingSettings;
    }

    public SupportedBackend toSupportedBackend() {
        return new SupportedBackend(type, name, description, requires, capabilities, exampleModels,
                missingSettings.get().isEmpty());
    }
}
