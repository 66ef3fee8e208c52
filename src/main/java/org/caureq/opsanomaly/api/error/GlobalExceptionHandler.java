package org.caureq.opsanomaly.api.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsanomaly.ml.DataQualityException;
import org.caureq.opsanomaly.ml.InsufficientDataException;
import org.caureq.opsanomaly.service.ArtifactException;
import org.caureq.opsanomaly.service.SampleWriteException;
import org.caureq.opsanomaly.service.StoreUnavailableException;
import org.springframework.http.*;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private ResponseEntity<ApiError> respond(HttpStatus status, ErrorCode code, String msg,
                                             HttpServletRequest req, Map<String,Object> details) {
        var body = new ApiError(Instant.now(), req.getRequestURI(), code, msg, req.getHeader("X-Correlation-Id"), details);
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
                                                     HttpServletRequest req) {
        var fields = ex.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .toList();
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.BAD_REQUEST, "Validation error", req,
                Map.of("fieldErrors", fields));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                       HttpServletRequest req) {
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.BAD_REQUEST,
                "invalid value for " + ex.getName() + ": " + ex.getValue(), req, Map.of());
    }

    @ExceptionHandler(SampleWriteException.class)
    public ResponseEntity<ApiError> handleWrite(SampleWriteException ex, HttpServletRequest req) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCode.WRITE_FAILED, ex.getMessage(), req, Map.of());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiError> handleStore(StoreUnavailableException ex, HttpServletRequest req) {
        return respond(HttpStatus.CONFLICT, ErrorCode.STORE_UNAVAILABLE, ex.getMessage(), req, Map.of());
    }

    @ExceptionHandler(DataQualityException.class)
    public ResponseEntity<ApiError> handleDataQuality(DataQualityException ex, HttpServletRequest req) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCode.DATA_QUALITY, ex.getMessage(), req,
                Map.of("feature", ex.feature().column()));
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ApiError> handleInsufficient(InsufficientDataException ex, HttpServletRequest req) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCode.INSUFFICIENT_DATA, ex.getMessage(), req, Map.of());
    }

    @ExceptionHandler(ArtifactException.class)
    public ResponseEntity<ApiError> handleArtifact(ArtifactException ex, HttpServletRequest req) {
        log.error("model bundle write failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.ARTIFACT_WRITE_FAILED, ex.getMessage(), req,
                Map.of("path", String.valueOf(ex.path())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArg(IllegalArgumentException ex,
                                                     HttpServletRequest req) {
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.BAD_REQUEST, ex.getMessage(), req, Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex, HttpServletRequest req) {
        log.error("unhandled error on {}", req.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR, ex.getMessage(), req, Map.of());
    }
}
