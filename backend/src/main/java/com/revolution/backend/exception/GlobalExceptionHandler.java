package com.revolution.backend.exception;

import com.revolution.backend.dto.ApiError;
import com.revolution.backend.dto.ApiErrorDetail;
import com.revolution.backend.security.RestAuthenticationEntryPoint;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps failures to {@link ApiError}. Authentication failures share one generic 401 body whatever the
 * internal reason; only a suspended account gets its own message.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String GENERIC_AUTH_MESSAGE = "Invalid credentials";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toDetail)
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, "Validation failed", details, request, ex);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getConstraintViolations().stream()
                .map(violation -> ApiErrorDetail.builder()
                        .field(violation.getPropertyPath().toString())
                        .issue(violation.getMessage())
                        .build())
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, "Validation failed", details, request, ex);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "Malformed request body", List.of(), request, null);
    }

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ApiError> handleBadRequest(BadRequestException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of(), request, null);
    }

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<ApiError> handleAuthenticationFailed(AuthenticationFailedException ex, HttpServletRequest request) {
        if (ex.getReason() == AuthFailureReason.USER_BANNED) {
            return respond(HttpStatus.FORBIDDEN, "ACCOUNT_SUSPENDED", RestAuthenticationEntryPoint.BANNED_MESSAGE, List.of(), null, request,
                    ex.getReason().name(), null);
        }
        return respond(HttpStatus.UNAUTHORIZED, HttpStatus.UNAUTHORIZED.name(), GENERIC_AUTH_MESSAGE, List.of(), null,
                request, ex.getReason().name(), null);
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ApiError> handleRateLimited(RateLimitedException ex, HttpServletRequest request) {
        return respond(HttpStatus.TOO_MANY_REQUESTS, ex.getDecision().status().name(), ex.getMessage(), List.of(),
                ex.getDecision().retryAfterSeconds(), request, ex.getReason().name(), null);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiError> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        return buildError(HttpStatus.FORBIDDEN, "Forbidden", List.of(), request, ex);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiError> handleConflict(ConflictException ex, HttpServletRequest request) {
        return buildError(HttpStatus.CONFLICT, ex.getMessage(), List.of(), request, null);
    }

    @ExceptionHandler(ServiceBusyException.class)
    public ResponseEntity<ApiError> handleBusy(ServiceBusyException ex, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE.name(), ex.getMessage(),
                List.of(), 1L, request, ex.getMessage(), ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("{} {} failed", request.getMethod(), request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, HttpStatus.INTERNAL_SERVER_ERROR.name(), "Unexpected error",
                List.of(), null, request, null, null);
    }

    private ApiErrorDetail toDetail(FieldError error) {
        return ApiErrorDetail.builder()
                .field(error.getField())
                .issue(error.getDefaultMessage())
                .build();
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, String message, List<ApiErrorDetail> details,
                                                HttpServletRequest request, Exception ex) {
        return respond(status, status.name(), message, details, null, request, message, ex);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String errorCode, String message,
                                             List<ApiErrorDetail> details, Long retryAfterSeconds,
                                             HttpServletRequest request, String logDetail, Exception ex) {
        ApiError error = ApiError.builder()
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorCode(errorCode)
                .message(message)
                .retryAfterSeconds(retryAfterSeconds)
                .requestId(MDC.get("requestId"))
                .correlationId(MDC.get("correlationId"))
                .details(details.isEmpty() ? null : details)
                .build();
        if (ex != null) {
            log.warn("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), logDetail, ex);
        } else if (status != HttpStatus.INTERNAL_SERVER_ERROR) {
            log.warn("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), logDetail);
        }
        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (retryAfterSeconds != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
        }
        return response.body(error);
    }
}
