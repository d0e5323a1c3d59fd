package com.revolution.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.headers.Header;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.IntegerSchema;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    static final String BEARER_SCHEME = "bearerAuth";

    @Bean
    public OpenAPI authOpenApi(JwtProperties jwtProperties) {
        SecurityScheme bearer = new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .bearerFormat("JWT")
                .description("Access token from /api/auth/login or /api/auth/refresh, valid for "
                        + jwtProperties.getExpiration().toMinutes() + " minutes");
        Components components = new Components()
                .addSecuritySchemes(BEARER_SCHEME, bearer)
                .addHeaders("Retry-After", new Header()
                        .description("Seconds until a rate-limited or locked caller may retry")
                        .schema(new IntegerSchema()));
        return new OpenAPI()
                .info(new Info()
                        .title("Revolution Trading Pros Auth API")
                        .description("Login, token refresh and revocation, two-factor enrollment and account security events.")
                        .version("1.0"))
                .components(components)
                .addTagsItem(new Tag().name("Auth").description("Credentials, tokens and the current account"))
                .addTagsItem(new Tag().name("MFA").description("TOTP enrollment and backup codes"));
    }
}
