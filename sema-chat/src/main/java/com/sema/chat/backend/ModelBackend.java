package com.sema.chat.backend;

import com.sema.chat.model.BackendDescriptor;
import com.sema.chat.model.BackendHealth;
import com.sema.chat.model.GenerationRequest;
import com.sema.chat.model.GenerationResult;
import com.sema.chat.stream.ChatStream;

/**
 * A unit of text generation, local or remote. The backend manager only ever holds
 * this type; provider framing, authentication and usage reporting stay inside each
 * implementation.
 */
public interface ModelBackend {

    /**
     * Registry identifier, e.g. {@code openai} or {@code local}.
     */
    String type();

    String modelName();

    /**
     * Acquires resources and runs one probe generation.
     *
     * @throws com.sema.chat.exception.ModelLoadException if the backend cannot be activated
     */
    void load();

    /**
     * Releases resources. Idempotent.
     *
     * @return false if releasing failed; the backend is considered unloaded either way
     */
    boolean unload();

    boolean isLoaded();

    /**
     * Single round trip, blocking for the caller.
     *
     * @throws com.sema.chat.exception.ModelNotLoadedException if called before {@link #load()}
     * @throws com.sema.chat.exception.GenerationException on backend fault, timeout or malformed response
     */
    GenerationResult generate(GenerationRequest request);

    /**
     * Starts a generation whose output is delivered incrementally.
     *
     * @throws com.sema.chat.exception.ModelNotLoadedException if called before {@link #load()}
     */
    ChatStream generateStream(GenerationRequest request);

    BackendDescriptor describe();

    /**
     * Trial generation bounded by the configured health timeout.
     */
    BackendHealth health();
}
