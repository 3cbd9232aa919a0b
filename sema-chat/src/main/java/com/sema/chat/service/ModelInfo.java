package com.sema.chat.service;

import com.sema.chat.model.BackendDescriptor;

/**
 * @param backend descriptor of the active backend, null while none is loaded
 */
public record ModelInfo(
        String backendType,
        String modelName,
        ManagerState state,
        boolean ready,
        BackendDescriptor backend,
        String lastError
) {
}
