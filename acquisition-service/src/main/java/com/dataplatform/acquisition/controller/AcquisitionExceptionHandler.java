package com.dataplatform.acquisition.controller;

import com.dataplatform.common.exception.AcquisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.List;
import java.util.stream.Collectors;

@RestControllerAdvice
public class AcquisitionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AcquisitionExceptionHandler.class);

    @ExceptionHandler(AcquisitionException.class)
    public ResponseEntity<ErrorResponse> onAcquisitionFailure(AcquisitionException e) {
        HttpStatus status = switch (e.getKind()) {
            case UNROUTABLE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TIMEOUT    -> HttpStatus.GATEWAY_TIMEOUT;
            default         -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        log.warn("[AcquisitionAPI] Acquisition failed. kind={} status={} attempts={} message={}",
                 e.getKind(), status.value(), e.getAttempts(), e.getMessage());
        return ResponseEntity.status(status)
            .body(new ErrorResponse(e.getKind().name(), e.getMessage(), e.getAttempts()));
    }

    @ExceptionHandler({WebExchangeBindException.class})
    public ResponseEntity<ErrorResponse> onInvalidBody(WebExchangeBindException e) {
        String message = e.getFieldErrors().stream()
            .map(f -> f.getField() + " " + f.getDefaultMessage())
            .collect(Collectors.joining(", "));
        log.info("[AcquisitionAPI] Rejected request body. errors={}", message);
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_REQUEST", message, List.of()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> onIllegalArgument(IllegalArgumentException e) {
        log.info("[AcquisitionAPI] Rejected request. error={}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_REQUEST", e.getMessage(), List.of()));
    }
}
