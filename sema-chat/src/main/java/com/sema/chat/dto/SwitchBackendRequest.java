package com.sema.chat.dto;

import jakarta.validation.constraints.NotBlank;

public record SwitchBackendRequest(
        @NotBlank String backendType,
        @NotBlank String modelName
) {
}
