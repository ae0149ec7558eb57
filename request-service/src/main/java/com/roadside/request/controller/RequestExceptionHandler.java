package com.roadside.request.controller;

import com.roadside.request.exception.ExternalUnavailableException;
import com.roadside.request.exception.InvalidTransitionException;
import com.roadside.request.exception.InvalidValueException;
import com.roadside.request.exception.RequestException;
import com.roadside.shared.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class RequestExceptionHandler {

    @ExceptionHandler(InvalidValueException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidValue(InvalidValueException ex) {
        return ResponseEntity.badRequest().body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidTransition(InvalidTransitionException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(ExternalUnavailableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnavailable(ExternalUnavailableException ex) {
        log.warn("External dependency unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(RequestException.class)
    public ResponseEntity<ApiResponse<Void>> handleRequest(RequestException ex) {
        HttpStatus status = switch (ex.getCode()) {
            case RequestException.REQUEST_NOT_FOUND, RequestException.PAYMENT_ATTEMPT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case RequestException.NOT_A_PARTY -> HttpStatus.FORBIDDEN;
            case RequestException.SERVICE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(ApiResponse.error(InvalidValueException.CODE, message));
    }
}
