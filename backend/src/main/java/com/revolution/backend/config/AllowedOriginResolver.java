package com.revolution.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Browser origins allowed to call the API with credentials.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AllowedOriginResolver {

    static final String ORIGINS_ENV = "REVOLUTION_ALLOWED_ORIGINS";

    private static final List<String> LOCAL_DEV_ORIGINS = List.of(
            "http://localhost:5173",
            "http://127.0.0.1:5173",
            "http://localhost:3000"
    );

    private final SecurityProperties securityProperties;
    private final Environment environment;

    /**
     * {@code REVOLUTION_ALLOWED_ORIGINS} (comma separated) wins over {@code revolution.security.cors.allowed-origins}.
     * Production refuses to start without either; elsewhere the local dev servers are allowed.
     */
    public List<String> resolveCorsAllowedOrigins() {
        String fromEnv = environment.getProperty(ORIGINS_ENV, "");
        List<String> origins = normalize(Arrays.asList(fromEnv.split(",")));
        if (origins.isEmpty()) {
            origins = normalize(securityProperties.getCors().getAllowedOrigins());
        }
        if (!origins.isEmpty()) {
            return origins;
        }
        if (environment.matchesProfiles("prod | production")) {
            throw new IllegalStateException("No CORS origins configured for production; set " + ORIGINS_ENV
                    + " or revolution.security.cors.allowed-origins");
        }
        log.info("No CORS origins configured, allowing local dev servers {}", LOCAL_DEV_ORIGINS);
        return LOCAL_DEV_ORIGINS;
    }

    private static List<String> normalize(Collection<String> raw) {
        List<String> origins = raw.stream()
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .map(origin -> origin.endsWith("/") ? origin.substring(0, origin.length() - 1) : origin)
                .distinct()
                .toList();
        for (String origin : origins) {
            if (origin.contains("*")) {
                throw new IllegalStateException("Wildcard CORS origin '" + origin + "' cannot be combined with credentials");
            }
        }
        return origins;
    }
}
