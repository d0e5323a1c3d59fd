package com.revolution.backend.security;

import com.revolution.backend.config.SecurityProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Client address used as the rate-limit key. {@code X-Forwarded-For} is honoured only when the service runs
 * behind a trusted proxy; otherwise any client could pick its own key.
 */
@Component
public class ClientAddressResolver {

    private static final String FORWARDED_FOR = "X-Forwarded-For";

    private final SecurityProperties securityProperties;

    public ClientAddressResolver(SecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    public String resolve(HttpServletRequest request) {
        if (securityProperties.isTrustForwardedHeaders()) {
            String forwarded = request.getHeader(FORWARDED_FOR);
            if (forwarded != null && !forwarded.isBlank()) {
                String first = forwarded.split(",")[0].trim();
                if (!first.isEmpty()) {
                    return first;
                }
            }
        }
        return request.getRemoteAddr();
    }
}
