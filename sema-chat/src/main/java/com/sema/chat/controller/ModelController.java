package com.sema.chat.controller;

import com.sema.chat.dto.SwitchBackendRequest;
import com.sema.chat.model.SupportedBackend;
import com.sema.chat.service.ModelInfo;
import com.sema.chat.service.ModelManager;
import com.sema.chat.service.SwitchResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/model")
@RequiredArgsConstructor
@Slf4j
public class ModelController {

    private final ModelManager modelManager;

    @GetMapping("/info")
    public ModelInfo info() {
        return modelManager.getModelInfo();
    }

    @GetMapping("/backends")
    public List<SupportedBackend> backends() {
        return modelManager.supportedBackends();
    }

    /**
     * Hot-swap the active backend. A failed switch answers 422 with the selection
     * that is active after rollback.
     */
    @PostMapping("/switch")
    public ResponseEntity<SwitchResult> switchBackend(@Valid @RequestBody SwitchBackendRequest request) {
        log.info("Backend switch requested: {} / {}", request.backendType(), request.modelName());
        SwitchResult result = modelManager.switchBackend(request.backendType(), request.modelName());
        return ResponseEntity.status(result.success() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY)
                .body(result);
    }
}
