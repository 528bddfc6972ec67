package com.ogt.tapak.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Traduce los errores del pipeline a {"status":"error","detail":...}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(TapakException.class)
    public ResponseEntity<Map<String, Object>> handleTapak(TapakException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("❌ {}", e.getMessage(), e);
        } else {
            log.info("Petición rechazada ({}): {}", e.getStatus().value(), e.getMessage());
        }
        return body(e.getStatus(), e.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleMultipartSize(MaxUploadSizeExceededException e) {
        return body(HttpStatus.PAYLOAD_TOO_LARGE, "File too large");
    }

    @ExceptionHandler({MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    // Cola del pool llena
    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleRejected(TaskRejectedException e) {
        log.warn("⚠️ Pool saturado, petición rechazada: {}", e.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Server busy, try again later");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDatabase(DataAccessException e) {
        log.error("❌ Error de base de datos", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Database error: " + e.getMostSpecificCause().getMessage());
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("detail", detail);
        return ResponseEntity.status(status).body(body);
    }
}
