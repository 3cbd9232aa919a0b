package com.sema.chat.service;

/**
 * Identifies one backend configuration: registry type plus model name.
 */
public record BackendSelection(String type, String modelName) {

    @Override
    public String toString() {
        return type + ":" + modelName;
    }
}
