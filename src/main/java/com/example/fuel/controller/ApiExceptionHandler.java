package com.example.fuel.controller;

import com.example.fuel.exception.FuelRouteException;
import com.example.fuel.exception.PlanningException;
import jakarta.servlet.ServletException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps failures onto {@code {"error": ..., "details": ...}} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        Map<String, List<String>> details = new TreeMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            details.computeIfAbsent(error.getField(), k -> new ArrayList<>()).add(error.getDefaultMessage());
        }
        return body(HttpStatus.BAD_REQUEST, "Validation failed", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return body(HttpStatus.BAD_REQUEST, "Validation failed", "Request body must be a JSON object with start and end");
    }

    @ExceptionHandler(FuelRouteException.class)
    public ResponseEntity<Map<String, Object>> handleFuelRoute(FuelRouteException e) {
        log.warn("Route calculation failed: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.getDetail(), null);
    }

    @ExceptionHandler(PlanningException.class)
    public ResponseEntity<Map<String, Object>> handlePlanning(PlanningException e) {
        log.warn("Route could not be planned: {}", e.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, e.getDetail(), null);
    }

    @ExceptionHandler(ServletException.class)
    public ResponseEntity<Map<String, Object>> handleServlet(ServletException e) {
        if (e instanceof ErrorResponse) {
            HttpStatusCode status = ((ErrorResponse) e).getStatusCode();
            return body(HttpStatus.valueOf(status.value()), e.getMessage(), null);
        }
        return handleUnexpected(e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, Object details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        if (details != null) {
            body.put("details", details);
        }
        return ResponseEntity.status(status).body(body);
    }
}
