package com.revolution.backend.config;

import com.revolution.backend.security.ClientAddressResolver;
import com.revolution.backend.security.LoginRateLimiter;
import com.revolution.backend.security.RateLimitDecision;
import com.revolution.backend.security.UserPrincipal;
import com.revolution.backend.service.SecurityMetrics;
import com.revolution.backend.service.ThrottleService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Counts every login request against the client address before the handler runs, and throttles token
 * refresh and MFA management. Failed logins are charged again by the login service with a heavier weight.
 */
@Component
@RequiredArgsConstructor
public class RateLimitInterceptor implements HandlerInterceptor {

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    private final LoginRateLimiter loginRateLimiter;
    private final ThrottleService throttleService;
    private final ClientAddressResolver clientAddressResolver;
    private final SecurityMetrics securityMetrics;
    private final ApiErrorWriter apiErrorWriter;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        String path = request.getRequestURI();
        String method = request.getMethod();
        if (!"POST".equalsIgnoreCase(method)) {
            return true;
        }
        if ("/api/auth/login".equals(path)) {
            return handleLogin(request, response);
        }
        if ("/api/auth/refresh".equals(path) || path.startsWith("/api/auth/mfa/")) {
            return handleThrottle(request, response);
        }
        return true;
    }

    private boolean handleLogin(HttpServletRequest request, HttpServletResponse response) throws Exception {
        RateLimitDecision decision = loginRateLimiter.recordAttempt("ip:" + clientAddressResolver.resolve(request));
        response.setHeader(LIMIT_HEADER, String.valueOf(decision.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
        if (decision.isAllowed()) {
            return true;
        }
        securityMetrics.recordRateLimitRejection(decision.status());
        String message = decision.status() == RateLimitDecision.Status.LOCKED
                ? "Too many failed attempts. Try again later."
                : "Rate limit exceeded";
        apiErrorWriter.write(request, response, 429, "TOO_MANY_REQUESTS", decision.status().name(), message,
                decision.retryAfterSeconds());
        return false;
    }

    private boolean handleThrottle(HttpServletRequest request, HttpServletResponse response) throws Exception {
        ThrottleService.Decision decision = throttleService.acquire(resolveKey(request));
        response.setHeader(LIMIT_HEADER, String.valueOf(decision.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
        if (decision.allowed()) {
            return true;
        }
        securityMetrics.recordRateLimitRejection(RateLimitDecision.Status.LIMITED);
        apiErrorWriter.write(request, response, 429, "TOO_MANY_REQUESTS", RateLimitDecision.Status.LIMITED.name(),
                "Rate limit exceeded", decision.retryAfterSeconds());
        return false;
    }

    private String resolveKey(HttpServletRequest request) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof UserPrincipal principal) {
            return "user:" + principal.getUserId();
        }
        return "ip:" + clientAddressResolver.resolve(request);
    }
}
