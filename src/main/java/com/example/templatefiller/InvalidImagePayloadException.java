package com.example.templatefiller;

/** Image data supplied for a placeholder could not be decoded into a raster image. */
public class InvalidImagePayloadException extends TemplateFillException {
    private final String token;

    public InvalidImagePayloadException(String token, String message) {
        super("Failed to decode image " + token + ": " + message);
        this.token = token;
    }

    public InvalidImagePayloadException(String token, String message, Throwable cause) {
        super("Failed to decode image " + token + ": " + message, cause);
        this.token = token;
    }

    public String getToken() { return token; }
}
