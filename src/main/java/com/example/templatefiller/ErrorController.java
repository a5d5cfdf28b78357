package com.example.templatefiller;

import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseBody;

/**
 * Container-level errors (unknown paths, wrong methods, failures outside a handler) in the same
 * {@link ErrorResponse} shape the handlers use.
 */
@Slf4j
@Controller
public class ErrorController implements org.springframework.boot.web.servlet.error.ErrorController {

    @RequestMapping("/error")
    @ResponseBody
    public ResponseEntity<ErrorResponse> handleError(HttpServletRequest request) {
        Integer statusCode = (Integer) request.getAttribute(RequestDispatcher.ERROR_STATUS_CODE);
        String errorMessage = (String) request.getAttribute(RequestDispatcher.ERROR_MESSAGE);
        Throwable exception = (Throwable) request.getAttribute(RequestDispatcher.ERROR_EXCEPTION);
        String uri = (String) request.getAttribute(RequestDispatcher.ERROR_REQUEST_URI);

        HttpStatus status = HttpStatus.resolve(statusCode != null ? statusCode : 500);
        if (status == null) status = HttpStatus.INTERNAL_SERVER_ERROR;

        String message = errorMessage != null && !errorMessage.isBlank() ? errorMessage : status.getReasonPhrase();
        if (exception != null) {
            log.error("Unhandled error for {}", uri, exception);
            if (exception.getMessage() != null) message = exception.getMessage();
        } else {
            log.debug("{} for {}", status.value(), uri);
        }
        return ResponseEntity.status(status).body(new ErrorResponse(status.name(), message));
    }
}
