package com.sema.chat.exception;

/**
 * Upstream or in-process fault while generating, including timeouts and malformed
 * provider responses.
 */
public class GenerationException extends ModelBackendException {

    private final Integer upstreamStatus;

    public GenerationException(String message) {
        this(message, null, null);
    }

    public GenerationException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public GenerationException(String message, Integer upstreamStatus, Throwable cause) {
        super(message, cause);
        this.upstreamStatus = upstreamStatus;
    }

    public Integer getUpstreamStatus() {
        return upstreamStatus;
    }
}
