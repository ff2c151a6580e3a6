package com.example.dedupscanner.console;

import com.example.dedupscanner.MutationConflictException;
import com.example.dedupscanner.console.ConsoleMessages.ErrorResponse;
import com.example.dedupscanner.index.IndexException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;

@RestControllerAdvice
public class ConsoleExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleExceptionHandler.class);

    @ExceptionHandler(MutationConflictException.class)
    public ResponseEntity<ErrorResponse> conflict(MutationConflictException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse("Conflicting file state", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request", ex.getMessage()));
    }

    @ExceptionHandler(IndexException.class)
    public ResponseEntity<ErrorResponse> indexFailure(IndexException ex) {
        LOGGER.error("Scan index failure", ex);
        return ResponseEntity.internalServerError().body(new ErrorResponse("Scan index unavailable", ex.getMessage()));
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> ioFailure(IOException ex) {
        LOGGER.error("File operation failed", ex);
        return ResponseEntity.internalServerError().body(new ErrorResponse("File operation failed", ex.getMessage()));
    }
}
