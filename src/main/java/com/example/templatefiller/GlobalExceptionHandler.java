package com.example.templatefiller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(TemplateNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(TemplateNotFoundException e) {
        log.warn("Template not found: {}", e.getKey());
        return respond(HttpStatus.NOT_FOUND, "TEMPLATE_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(InvalidImagePayloadException.class)
    public ResponseEntity<ErrorResponse> handleInvalidImage(InvalidImagePayloadException e) {
        log.warn("Rejected image for {}: {}", e.getToken(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_IMAGE", e.getMessage());
    }

    @ExceptionHandler(CorruptArchiveException.class)
    public ResponseEntity<ErrorResponse> handleCorruptArchive(CorruptArchiveException e) {
        log.warn("Corrupt template: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "CORRUPT_TEMPLATE", e.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(StorageException e) {
        log.error("Storage failure", e);
        return respond(HttpStatus.BAD_GATEWAY, "STORAGE_ERROR", e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Bad request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(TemplateFillException.class)
    public ResponseEntity<ErrorResponse> handleFill(TemplateFillException e) {
        log.error("Template fill failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "FILL_FAILED", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message));
    }
}
