package com.eldplanner.controller;

import com.eldplanner.controller.dto.ErrorResponse;
import com.eldplanner.exception.InsufficientInputException;
import com.eldplanner.exception.InvalidInputException;
import com.eldplanner.exception.NoValidLogsException;
import com.eldplanner.exception.PlannerException;
import com.eldplanner.exception.TripNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps planner failures onto HTTP status codes and a uniform error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request data", fields));
    }

    @ExceptionHandler({InsufficientInputException.class, InvalidInputException.class})
    public ResponseEntity<ErrorResponse> handleBadInput(PlannerException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request data", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("Invalid request data", "Request body is not valid JSON for this endpoint"));
    }

    @ExceptionHandler(TripNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(TripNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("Trip not found", e.getMessage()));
    }

    @ExceptionHandler(NoValidLogsException.class)
    public ResponseEntity<ErrorResponse> handleNoValidLogs(NoValidLogsException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ErrorResponse("No valid logs", e.getMessage()));
    }

    @ExceptionHandler(PlannerException.class)
    public ResponseEntity<ErrorResponse> handlePlanner(PlannerException e) {
        log.error("Trip planning failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("Failed to calculate trip plan", e.getMessage()));
    }

    // Argument checks inside the planner are programming errors, not bad requests.
    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleInternal(RuntimeException e) {
        log.error("Unexpected planner failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("Failed to calculate trip plan", e.getMessage()));
    }
}
