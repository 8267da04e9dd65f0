package com.demo.rent.config;

import com.demo.rent.service.error.AuthorizationException;
import com.demo.rent.service.error.ExpiryException;
import com.demo.rent.service.error.IneligibleException;
import com.demo.rent.service.error.LeaseStateException;
import com.demo.rent.service.error.NotFoundException;
import com.demo.rent.service.error.ReentrancyException;
import com.demo.rent.service.error.RentGateException;
import com.demo.rent.service.error.ReplayException;
import com.demo.rent.service.error.TransferFailedException;
import com.demo.rent.service.error.VerificationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import jakarta.servlet.http.HttpServletRequest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(RentGateException.class)
    public ResponseEntity<Map<String, Object>> handleDomain(RentGateException ex, HttpServletRequest req) {
        HttpStatus status = statusOf(ex);
        return ResponseEntity.status(status)
                .body(body(status, ex.getCode().name(), ex.getMessage(), req));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, MissingRequestHeaderException.class,
            HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(Exception ex, HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), req);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return ResponseEntity.status(status)
                .body(body(status, status.name(), ex.getReason(), req));
    }

    @ExceptionHandler(DataAccessException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleSql(DataAccessException ex, HttpServletRequest req) {
        log.error("Database error on {}", req.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "DATABASE_ERROR",
                ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage(), req);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleAny(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {}", req.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL", ex.getMessage(), req);
    }

    static HttpStatus statusOf(RentGateException ex) {
        if (ex instanceof AuthorizationException || ex instanceof IneligibleException) {
            return HttpStatus.FORBIDDEN;
        }
        if (ex instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof ReplayException || ex instanceof LeaseStateException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof ExpiryException) {
            return HttpStatus.GONE;
        }
        if (ex instanceof VerificationException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (ex instanceof ReentrancyException) {
            return HttpStatus.LOCKED;
        }
        if (ex instanceof TransferFailedException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private static Map<String, Object> body(HttpStatus status, String reason, String message, HttpServletRequest req) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("timestamp", Instant.now());
        out.put("status", status.value());
        out.put("error", status.getReasonPhrase());
        out.put("reason", reason);
        out.put("message", message);
        out.put("path", req.getRequestURI());
        return out;
    }
}
