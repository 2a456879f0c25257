package com.example.qkd.controller;

import com.example.qkd.exception.QkdConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class KmsExceptionHandler {

    @ExceptionHandler(QkdConfigurationException.class)
    public ResponseEntity<ErrorResponse> onConfigurationError(QkdConfigurationException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(e.getMessage(), null, null, null));
    }
}
