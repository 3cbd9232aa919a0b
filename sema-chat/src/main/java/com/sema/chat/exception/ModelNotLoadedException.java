package com.sema.chat.exception;

public class ModelNotLoadedException extends ModelBackendException {

    public ModelNotLoadedException(String message) {
        super(message);
    }
}
