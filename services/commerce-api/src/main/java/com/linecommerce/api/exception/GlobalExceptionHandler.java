package com.linecommerce.api.exception;

import com.linecommerce.api.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GlobalExceptionHandler - Translates exceptions into HTTP error responses.
 *
 * Authentication errors are rendered from their {@link AuthErrorKind} only,
 * so no collaborator message or stack detail ever reaches a client.
 * Unexpected exceptions are logged and answered with a generic 500.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ErrorResponse> handleAuth(AuthException e) {
        AuthErrorKind kind = e.getKind();
        if (e.getCause() != null) {
            log.debug("Authentication failure {} caused by {}", kind.getCode(), e.getCause().toString());
        }

        ResponseEntity.BodyBuilder builder = ResponseEntity.status(kind.getStatus());
        if (kind.getStatus() == HttpStatus.UNAUTHORIZED) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        return builder.body(ErrorResponse.builder()
                .error(kind.getCode())
                .detail(kind.getMessage())
                .build());
    }

    @ExceptionHandler(ItemNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleItemNotFound(ItemNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.builder()
                .error("not_found")
                .detail(e.getMessage())
                .build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("validation_failed")
                .detail("Request validation failed")
                .fields(fields)
                .build());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception e) {
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("bad_request")
                .detail(e.getMessage())
                .build());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("bad_request")
                .detail("Malformed request body")
                .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        // framework exceptions (unknown route, wrong method, bad media type) carry their own status
        if (e instanceof org.springframework.web.ErrorResponse) {
            org.springframework.web.ErrorResponse frameworkError = (org.springframework.web.ErrorResponse) e;
            HttpStatusCode status = frameworkError.getStatusCode();
            return ResponseEntity.status(status).body(ErrorResponse.builder()
                    .error(status.is4xxClientError() ? "bad_request" : "internal_error")
                    .detail(frameworkError.getBody().getDetail())
                    .build());
        }

        log.error("Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.builder()
                .error("internal_error")
                .detail("Internal server error")
                .build());
    }
}
