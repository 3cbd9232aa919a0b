package com.sema.chat.backend;

import com.sema.chat.exception.ModelLoadException;
import com.sema.chat.model.GenerationParameters;
import de.kherud.llama.InferenceParameters;
import de.kherud.llama.LlamaIterator;
import de.kherud.llama.LlamaModel;
import de.kherud.llama.LlamaOutput;
import de.kherud.llama.ModelParameters;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * GGUF models through the llama.cpp JNI bindings.
 */
@Slf4j
public class LlamaCppInferenceEngine implements LocalInferenceEngine {

    private final Path modelPath;
    private final String device;
    private final int gpuLayers;
    private LlamaModel model;

    public LlamaCppInferenceEngine(Path modelPath, String device, int gpuLayers) {
        this.modelPath = modelPath;
        this.device = device == null ? "auto" : device;
        this.gpuLayers = gpuLayers;
    }

    @Override
    public void load() {
        if (!Files.isRegularFile(modelPath)) {
            throw new ModelLoadException("Model weights not found at " + modelPath);
        }
        int layers = "cpu".equalsIgnoreCase(device) ? 0 : gpuLayers;
        log.info("Loading llama.cpp model from {} (device={}, gpuLayers={})", modelPath, device, layers);
        try {
            model = new LlamaModel(new ModelParameters()
                    .setModel(modelPath.toString())
                    .setGpuLayers(layers));
        } catch (RuntimeException e) {
            throw new ModelLoadException("Failed to load model weights from " + modelPath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int generate(String prompt, GenerationParameters parameters, Consumer<String> onPiece) {
        if (model == null) {
            throw new IllegalStateException("llama.cpp model is not loaded");
        }
        InferenceParameters inference = new InferenceParameters(prompt)
                .setTemperature((float) parameters.temperature())
                .setTopP((float) parameters.topP())
                .setTopK(parameters.topK())
                .setNPredict(parameters.maxTokens())
                .setRepeatPenalty(1.1f)
                .setStopStrings("\nUser:", "\nSystem:");
        LlamaIterator iterator = model.generate(inference).iterator();
        int tokens = 0;
        boolean finished = false;
        try {
            while (iterator.hasNext()) {
                LlamaOutput output = iterator.next();
                onPiece.accept(output.toString());
                tokens++;
            }
            finished = true;
        } finally {
            if (!finished) {
                iterator.cancel();
            }
        }
        return tokens;
    }

    @Override
    public Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("model_path", modelPath.toString());
        details.put("device", device);
        details.put("gpu_layers", gpuLayers);
        return details;
    }

    @Override
    public void close() {
        if (model != null) {
            model.close();
            model = null;
        }
    }
}
