package com.sema.chat.exception;

/**
 * Base type for failures raised by a model backend.
 */
public class ModelBackendException extends RuntimeException {

    public ModelBackendException(String message) {
        super(message);
    }

    public ModelBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
