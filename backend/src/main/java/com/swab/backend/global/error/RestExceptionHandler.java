package com.swab.backend.global.error;

import java.util.regex.Pattern;

import com.swab.backend.modules.scheduler.application.NotificationStoreException;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@ControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);
    private static final Pattern ERROR_CODE = Pattern.compile("[A-Z][A-Z0-9_]+");

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblemException(ProblemException ex, HttpServletRequest request) {
        HttpStatus status = resolveStatus(ex.getStatusCode());
        if (status.is5xxServerError()) {
            log.error("request failed code={} detail={}", ex.getCode(), ex.getDetailMessage(), ex);
        }
        ProblemResponse body = ProblemResponse.of(status, ex.getCode(), ex.getDetailMessage(), request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleResponseStatusException(ResponseStatusException ex,
                                                                         HttpServletRequest request) {
        HttpStatus status = resolveStatus(ex.getStatusCode());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        ProblemResponse body = ProblemResponse.of(status, message, message, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(MethodArgumentNotValidException ex,
                                                                     HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String detail = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : "Validation failed";
        ProblemResponse body = ProblemResponse.of(status, resolveValidationCode(ex), detail, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                              HttpServletRequest request) {
        String code = "id".equals(ex.getName()) ? "INVALID_ID" : "INVALID_PARAMETER";
        String detail = ex.getName() + ": cannot convert '" + ex.getValue() + "'";
        ProblemResponse body = ProblemResponse.of(HttpStatus.BAD_REQUEST, code, detail, request.getRequestURI());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemResponse> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                                HttpServletRequest request) {
        ProblemResponse body = ProblemResponse.of(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST",
                "Request body is missing or is not valid JSON", request.getRequestURI());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ProblemResponse> handleUnknownRoute(NoResourceFoundException ex, HttpServletRequest request) {
        ProblemResponse body = ProblemResponse.of(HttpStatus.NOT_FOUND, "ROUTE_NOT_FOUND",
                ex.getHttpMethod() + " /" + ex.getResourcePath(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(NotificationStoreException.class)
    public ResponseEntity<ProblemResponse> handleStoreException(NotificationStoreException ex,
                                                                HttpServletRequest request) {
        log.error("[ALERT][Store] notification store unavailable path={}", request.getRequestURI(), ex);
        ProblemResponse body = ProblemResponse.of(HttpStatus.INTERNAL_SERVER_ERROR, "STORE_UNAVAILABLE",
                ex.getMessage(), request.getRequestURI());
        return ResponseEntity.internalServerError().body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("unhandled error path={}", request.getRequestURI(), ex);
        ProblemResponse body = ProblemResponse.of(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                ex.getMessage(), request.getRequestURI());
        return ResponseEntity.internalServerError().body(body);
    }

    /**
     * A single failing constraint whose message is an error code (e.g. {@code MESSAGE_REQUIRED}) becomes the code.
     */
    private String resolveValidationCode(MethodArgumentNotValidException ex) {
        if (ex.getBindingResult().getErrorCount() == 1 && ex.getBindingResult().getFieldError() != null) {
            String message = ex.getBindingResult().getFieldError().getDefaultMessage();
            if (message != null && ERROR_CODE.matcher(message).matches()) {
                return message;
            }
        }
        return "validation_error";
    }

    private HttpStatus resolveStatus(HttpStatusCode statusCode) {
        return statusCode instanceof HttpStatus httpStatus
                ? httpStatus
                : HttpStatus.valueOf(statusCode.value());
    }
}
