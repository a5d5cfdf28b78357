package com.example.templatefiller;

/** The template bytes are not a Word package of the expected shape. */
public class CorruptArchiveException extends TemplateFillException {
    public CorruptArchiveException(String message) {
        super(message);
    }

    public CorruptArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
