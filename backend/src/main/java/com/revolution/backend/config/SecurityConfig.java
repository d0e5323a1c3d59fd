package com.revolution.backend.config;

import com.revolution.backend.security.JwtAuthenticationFilter;
import com.revolution.backend.security.RestAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final JwtAuthenticationFilter jwtAuthFilter;
    private final SecurityProperties securityProperties;
    private final AllowedOriginResolver allowedOriginResolver;
    private final RestAuthenticationEntryPoint restAuthenticationEntryPoint;
    private final ApiErrorWriter apiErrorWriter;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .cors(cors -> cors.configurationSource(corsConfigurationSource()))
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .httpBasic(basic -> basic.disable())
            .formLogin(form -> form.disable())
            .exceptionHandling(ex -> ex
                .authenticationEntryPoint(restAuthenticationEntryPoint)
                .accessDeniedHandler((request, response, denied) -> apiErrorWriter.write(request, response,
                        HttpStatus.FORBIDDEN.value(), "FORBIDDEN", "ACCESS_DENIED", "Access denied", null))
            )
            .authorizeHttpRequests(auth -> auth
                // public: credentials or refresh token in the body
                .requestMatchers("/api/auth/login", "/api/auth/refresh").permitAll()
                // public so that an expired or revoked token can still log out
                .requestMatchers("/api/auth/logout").permitAll()
                .requestMatchers("/actuator/health", "/actuator/health/**").access((authentication, context) -> {
                    boolean isPublic = securityProperties.isPublicHealthEndpoint();
                    boolean isAuthenticated = authentication.get() != null && authentication.get().isAuthenticated();
                    return new AuthorizationDecision(isPublic || isAuthenticated);
                })
                .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                .requestMatchers("/error").permitAll()
                .anyRequest().authenticated()
            )
            .addFilterBefore(jwtAuthFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration cfg = new CorsConfiguration();
        cfg.setAllowedOrigins(allowedOriginResolver.resolveCorsAllowedOrigins());
        cfg.setAllowedMethods(securityProperties.getCors().getAllowedMethods());
        cfg.setAllowedHeaders(List.of("*"));
        cfg.setExposedHeaders(List.of("Retry-After", "X-RateLimit-Limit", "X-RateLimit-Remaining",
                "X-Request-Id", "X-Correlation-Id"));
        cfg.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", cfg);
        return source;
    }
}
