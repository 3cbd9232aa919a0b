package com.sema.chat.model;

import java.util.List;
import java.util.Set;

/**
 * Registry metadata for one backend type.
 *
 * @param configured true when every required setting is present
 */
public record SupportedBackend(
        String type,
        String name,
        String description,
        List<String> requires,
        Set<String> capabilities,
        List<String> exampleModels,
        boolean configured
) {
}
