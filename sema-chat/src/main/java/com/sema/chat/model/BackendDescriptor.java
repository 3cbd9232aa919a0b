package com.sema.chat.model;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only view of a backend's state.
 *
 * @param details provider-specific fields (endpoint, device, API version)
 */
public record BackendDescriptor(
        String name,
        String type,
        boolean loaded,
        Set<String> capabilities,
        Map<String, Object> parameters,
        Map<String, Object> details
) {
    public BackendDescriptor {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        parameters = withoutNulls(parameters);
        details = withoutNulls(details);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> source) {
        if (source == null) {
            return Map.of();
        }
        return source.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }
}
