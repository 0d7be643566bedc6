package com.baykanat.insider.analytics.api.exception;

import com.baykanat.insider.analytics.domain.exception.InvalidParameterException;
import com.baykanat.insider.analytics.domain.exception.QueryExecutionException;
import com.baykanat.insider.analytics.domain.exception.StoreUnavailableException;
import com.baykanat.insider.analytics.domain.exception.UnauthorizedSiteAccessException;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** REST hatalarını tek yerde toplar: 400 parametre, 403 erişim, 503 circuit breaker, 500 diğer. */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidParameterException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidParameter(InvalidParameterException ex) {
        log.debug("Rejected parameter {}: {}", ex.getField(), ex.getMessage());
        List<Map<String, String>> details = List.of(Map.of(
                "field", ex.getField(),
                "message", ex.getMessage()
        ));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, "Invalid parameter", details));
    }

    /** @Valid sorgu nesnesi: kısıt ihlali veya tipe dönüştürülemeyen değer (ör. pastMinutes=abc) → 400. */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", error.getField(),
                        "message", error.isBindingFailure() || error.getDefaultMessage() == null
                                ? "Invalid value for " + error.getField()
                                : error.getDefaultMessage()
                ))
                .toList();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, "Invalid parameter", fieldErrors));
    }

    /** @RequestParam kısıtları (limit, offset) → 400; alan adı yolun son düğümüdür. */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(ConstraintViolationException ex) {
        List<Map<String, String>> violations = ex.getConstraintViolations().stream()
                .map(v -> Map.of(
                        "field", lastNode(v.getPropertyPath()),
                        "message", v.getMessage()
                ))
                .toList();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, "Invalid parameter", violations));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        List<Map<String, String>> details = List.of(Map.of(
                "field", ex.getName(),
                "message", "Invalid value for " + ex.getName()
        ));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, "Invalid parameter", details));
    }

    /** Eksik zorunlu parametre → 400. */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParam(MissingServletRequestParameterException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, "Missing required parameter: " + ex.getParameterName(), null));
    }

    @ExceptionHandler(UnauthorizedSiteAccessException.class)
    public ResponseEntity<Map<String, Object>> handleUnauthorized(UnauthorizedSiteAccessException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(errorBody(HttpStatus.FORBIDDEN, ex.getMessage(), null));
    }

    /** SQL zaten repository'de loglandı; istemciye yalnızca jenerik mesaj. */
    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<Map<String, Object>> handleQueryExecution(QueryExecutionException ex) {
        log.error("Analytics query {} failed: {}", ex.getStatementName(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to execute analytics query", null));
    }

    /** Circuit breaker açık → 503 + Retry-After. */
    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Analytics store unavailable: {}", ex.getMessage());

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()));

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .headers(headers)
                .body(errorBody(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), null));
    }

    /** Beklenmeyen hatalar → 500, istemciye jenerik mesaj. */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", null));
    }

    private static String lastNode(Path path) {
        String field = path.toString();
        for (Path.Node node : path) {
            field = node.getName();
        }
        return field;
    }

    private Map<String, Object> errorBody(HttpStatus status, String message, Object details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        if (details != null) {
            body.put("details", details);
        }
        return body;
    }
}
