package com.sema.chat.backend;

import com.sema.chat.model.GenerationParameters;

import java.util.Map;
import java.util.function.Consumer;

/**
 * In-process text generation over locally stored weights. Implementations are not
 * required to be thread-safe; {@link LocalModelBackend} serializes all calls.
 */
public interface LocalInferenceEngine extends AutoCloseable {

    /**
     * Loads weights into memory.
     *
     * @throws com.sema.chat.exception.ModelLoadException if the weights are missing or unreadable
     */
    void load();

    /**
     * Generates a continuation of {@code prompt}, passing each decoded piece to
     * {@code onPiece} as it is produced. Exceptions thrown by {@code onPiece} abort
     * generation and propagate.
     *
     * @return number of generated tokens
     */
    int generate(String prompt, GenerationParameters parameters, Consumer<String> onPiece);

    Map<String, Object> details();

    @Override
    void close();
}
