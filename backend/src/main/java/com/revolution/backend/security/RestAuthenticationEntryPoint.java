package com.revolution.backend.security;

import com.revolution.backend.config.ApiErrorWriter;
import com.revolution.backend.exception.AuthFailureReason;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Answers unauthenticated access to a protected route. The failure reason stays internal, except for a banned
 * account, which gets a 403 with an explicit message.
 */
@Component
@RequiredArgsConstructor
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    public static final String GENERIC_MESSAGE = "Authentication required";
    public static final String BANNED_MESSAGE = "This account has been suspended.";

    private final ApiErrorWriter apiErrorWriter;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException, ServletException {
        if (request.getAttribute(JwtAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE) == AuthFailureReason.USER_BANNED) {
            apiErrorWriter.write(request, response, HttpServletResponse.SC_FORBIDDEN,
                    "FORBIDDEN", "ACCOUNT_SUSPENDED", BANNED_MESSAGE, null);
            return;
        }
        apiErrorWriter.write(request, response, HttpServletResponse.SC_UNAUTHORIZED,
                "UNAUTHORIZED", "UNAUTHORIZED", GENERIC_MESSAGE, null);
    }
}
