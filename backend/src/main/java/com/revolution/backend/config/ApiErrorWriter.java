package com.revolution.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.revolution.backend.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;

/**
 * Writes {@link ApiError} bodies from filters and interceptors, outside the reach of the controller advice.
 */
@Component
public class ApiErrorWriter {

    private final ObjectMapper objectMapper;

    public ApiErrorWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletRequest request, HttpServletResponse response, int status,
                      String error, String errorCode, String message, Long retryAfterSeconds) throws IOException {
        ApiError body = ApiError.builder()
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .status(status)
                .error(error)
                .errorCode(errorCode)
                .message(message)
                .retryAfterSeconds(retryAfterSeconds)
                .requestId(MDC.get("requestId"))
                .correlationId(MDC.get("correlationId"))
                .build();
        response.setStatus(status);
        response.setContentType("application/json");
        if (retryAfterSeconds != null) {
            response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        }
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
