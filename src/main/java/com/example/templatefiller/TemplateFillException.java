package com.example.templatefiller;

/** Base class of every failure a fill request can end with. */
public class TemplateFillException extends RuntimeException {
    public TemplateFillException(String message) {
        super(message);
    }

    public TemplateFillException(String message, Throwable cause) {
        super(message, cause);
    }
}
