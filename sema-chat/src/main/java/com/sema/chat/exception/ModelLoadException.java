package com.sema.chat.exception;

/**
 * A backend could not be activated. Fatal to that activation only.
 */
public class ModelLoadException extends ModelBackendException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
