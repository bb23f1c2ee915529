package com.healthcoach.backend.common.web;

import com.healthcoach.backend.coach.exception.RecommendationGenerationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Maps exceptions to a predictable status and body {code, message, requestId[, fields]}:
 * - 400: validation / unreadable body / IllegalArgument
 * - 404: PROFILE_NOT_FOUND / PLAN_NOT_FOUND / NoSuchElementException
 * - 409: unique key hit by a concurrent write
 * - 422: PROFILE_INCOMPLETE
 * - 500: RECOMMENDATION_FAILED and everything unexpected
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    public static final String PROFILE_NOT_FOUND = "PROFILE_NOT_FOUND";
    public static final String PLAN_NOT_FOUND = "PLAN_NOT_FOUND";
    public static final String PROFILE_INCOMPLETE = "PROFILE_INCOMPLETE";

    // ===== 400 Bad Request =====

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex,
                                                                HttpServletRequest req) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            // first message per field only
            fields.putIfAbsent(fe.getField(), fe.getDefaultMessage());
        }
        Map<String, Object> body = err("VALIDATION_FAILED", "Validation failed", req);
        body.put("fields", fields);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(err("BAD_REQUEST", ex.getMessage(), req));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex,
                                                                HttpServletRequest req) {
        return ResponseEntity.badRequest().body(err("BAD_REQUEST", "Malformed JSON request", req));
    }

    // ===== 404 / 422 / 500 from IllegalStateException codes =====

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException ex,
                                                                  HttpServletRequest req) {
        String code = (ex.getMessage() == null || ex.getMessage().isBlank())
                ? "ILLEGAL_STATE"
                : ex.getMessage().trim();

        HttpStatus status = switch (code) {
            case PROFILE_NOT_FOUND, PLAN_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PROFILE_INCOMPLETE -> HttpStatus.UNPROCESSABLE_ENTITY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) log.error("[Api] illegal state", ex);

        return ResponseEntity.status(status).body(err(code, ex.getMessage(), req));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, Object>> handleNoSuch(NoSuchElementException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(err("NOT_FOUND", ex.getMessage(), req));
    }

    // ===== 409 =====

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(DataIntegrityViolationException ex,
                                                              HttpServletRequest req) {
        log.warn("[Api] conflict {} {}: {}", req.getMethod(), req.getRequestURI(),
                ex.getMostSpecificCause().getMessage());
        // constraint details stay in the log
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(err("CONFLICT", "Concurrent update, please retry", req));
    }

    // ===== 500 =====

    @ExceptionHandler(RecommendationGenerationException.class)
    public ResponseEntity<Map<String, Object>> handleCoachFailure(RecommendationGenerationException ex,
                                                                  HttpServletRequest req) {
        // already logged with the cause by CoachService
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err(RecommendationGenerationException.CODE, ex.getMessage(), req));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, HttpServletRequest req) {
        // framework errors (404 route, 405 method, 415 ...) keep their own status
        if (ex instanceof ErrorResponse er && !er.getStatusCode().is5xxServerError()) {
            return ResponseEntity.status(er.getStatusCode())
                    .body(err("HTTP_" + er.getStatusCode().value(), ex.getMessage(), req));
        }
        log.error("[Api] unhandled {} {}", req.getMethod(), req.getRequestURI(), ex);
        // internal details stay in the log
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", "Internal server error", req));
    }

    private static Map<String, Object> err(String code, String message, HttpServletRequest req) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        String rid = RequestIdFilter.current(req);
        if (rid != null) m.put("requestId", rid);
        return m;
    }
}
