package com.logflow.anomaly.controller;

import com.logflow.anomaly.dto.ErrorResponseDto;
import com.logflow.anomaly.exceptions.DetectionRejectedException;
import com.logflow.anomaly.exceptions.DetectionTimeoutException;
import com.logflow.anomaly.exceptions.LogStoreUnavailableException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(LogStoreUnavailableException.class)
    public ResponseEntity<ErrorResponseDto> handleStoreUnavailable(LogStoreUnavailableException ex) {
        log.error("Anomaly detection could not read the log store: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(DetectionRejectedException.class)
    public ResponseEntity<ErrorResponseDto> handleRejected(DetectionRejectedException ex) {
        log.warn("Anomaly detection refused: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(DetectionTimeoutException.class)
    public ResponseEntity<ErrorResponseDto> handleTimeout(DetectionTimeoutException ex) {
        return error(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, ConstraintViolationException.class,
            HandlerMethodValidationException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponseDto> handleBadRequest(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    private static ResponseEntity<ErrorResponseDto> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ErrorResponseDto.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .timestamp(Instant.now())
                .build());
    }
}
