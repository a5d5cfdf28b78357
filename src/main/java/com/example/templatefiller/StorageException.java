package com.example.templatefiller;

/** Object storage rejected or failed an upload or download. */
public class StorageException extends TemplateFillException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
