package com.smallbiz.agent.controller;

import com.smallbiz.agent.exception.ConflictException;
import com.smallbiz.agent.exception.NotFoundException;
import com.smallbiz.agent.exception.ProviderSyncException;
import com.smallbiz.agent.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> validation(ValidationException e) {
        return body(HttpStatus.BAD_REQUEST, "validation_error", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return body(HttpStatus.BAD_REQUEST, "validation_error", message);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(NotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<Map<String, Object>> conflict(ConflictException e) {
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.CONFLICT, "conflict", e.getMessage());
        response.getBody().put("alternatives", e.getAlternatives());
        return response;
    }

    @ExceptionHandler(ProviderSyncException.class)
    public ResponseEntity<Map<String, Object>> providerFailure(ProviderSyncException e) {
        log.warn("Calendar provider failure: {}", e.getMessage());
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.BAD_GATEWAY, "provider_error", e.getMessage());
        response.getBody().put("provider", e.getProvider().code());
        return response;
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
