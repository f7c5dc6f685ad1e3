package com.relaygate.controller;

import com.relaygate.exception.GatewayException;
import com.relaygate.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps exceptions that escape a controller to the structured error body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGatewayException(GatewayException e) {
        log.warn("Request failed: [{}] {}", e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(e.getStatus())
                .body(ErrorResponse.builder()
                        .errorCode(e.getErrorCode())
                        .message(e.getMessage())
                        .build());
    }

    /**
     * Framework rejections: unreadable body (400), unknown path, unsupported media type.
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException e) {
        log.debug("Request rejected: {} {}", e.getStatusCode(), e.getReason());
        String errorCode = e instanceof ServerWebInputException
                ? "VALIDATION_ERROR"
                : "HTTP_" + e.getStatusCode().value();
        return ResponseEntity.status(e.getStatusCode())
                .body(ErrorResponse.builder()
                        .errorCode(errorCode)
                        .message(e.getReason() != null ? e.getReason() : "Malformed request")
                        .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.builder()
                        .errorCode("INTERNAL_ERROR")
                        .message("Internal error")
                        .build());
    }
}
