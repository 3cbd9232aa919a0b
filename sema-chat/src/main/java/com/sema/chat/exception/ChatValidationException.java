package com.sema.chat.exception;

public class ChatValidationException extends RuntimeException {

    private final String field;

    public ChatValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
