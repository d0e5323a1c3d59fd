package com.revolution.backend.security;

import com.revolution.backend.config.JwtProperties;
import com.revolution.backend.exception.AuthFailureReason;
import com.revolution.backend.exception.TokenVerificationException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.InvalidClaimException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Signs and verifies HS256 bearer tokens.
 *
 * <p>Verification order is fixed: segment shape, signature, expiry, issuer, audience, token type.
 * Nothing inside the payload is trusted before the signature matches. Access and refresh tokens are signed
 * with different keys; {@code token_type} is still checked so a shared key cannot be used for type confusion.
 */
@Slf4j
@Component
public class TokenCodec {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_TOKEN_TYPE = "token_type";
    static final String CLAIM_TOKEN_VERSION = "token_version";

    private static final int MIN_SECRET_LENGTH = 32;
    private static final Pattern COMPACT_SHAPE = Pattern.compile("[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+");
    private static final byte[] REFRESH_KEY_LABEL = "revolution/refresh-token-key/v1".getBytes(StandardCharsets.UTF_8);

    private final JwtProperties properties;
    private final Clock clock;

    private volatile SecretKey accessKey;
    private volatile SecretKey refreshKey;
    private volatile JwtParser accessParser;
    private volatile JwtParser refreshParser;

    public TokenCodec(JwtProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void validateSecrets() {
        byte[] accessBytes;
        String secret = properties.getSecret();
        if (secret == null || secret.isBlank()) {
            log.error("Missing JWT secret. Set JWT_SECRET; using an ephemeral key, tokens will not survive restart.");
            accessBytes = randomKey();
        } else if (secret.length() < MIN_SECRET_LENGTH) {
            log.error("JWT secret must be at least {} characters; using an ephemeral key.", MIN_SECRET_LENGTH);
            accessBytes = randomKey();
        } else {
            accessBytes = secret.getBytes(StandardCharsets.UTF_8);
        }

        byte[] refreshBytes;
        String refreshSecret = properties.getRefreshSecret();
        if (refreshSecret == null || refreshSecret.isBlank()) {
            log.warn("No jwt.refresh-secret configured; deriving the refresh signing key from jwt.secret.");
            refreshBytes = deriveKey(accessBytes);
        } else if (refreshSecret.length() < MIN_SECRET_LENGTH) {
            log.error("JWT refresh secret must be at least {} characters; deriving it from jwt.secret.", MIN_SECRET_LENGTH);
            refreshBytes = deriveKey(accessBytes);
        } else {
            refreshBytes = refreshSecret.getBytes(StandardCharsets.UTF_8);
        }

        accessKey = Keys.hmacShaKeyFor(accessBytes);
        refreshKey = Keys.hmacShaKeyFor(refreshBytes);
        accessParser = parser(accessKey);
        refreshParser = parser(refreshKey);
    }

    public String issueAccessToken(String subject, String email, String role, int tokenVersion) {
        return issue(subject, email, role, tokenVersion, properties.getExpiration(), TokenType.ACCESS);
    }

    public String issueRefreshToken(String subject, String email, String role, int tokenVersion) {
        return issue(subject, email, role, tokenVersion, properties.getRefreshExpiration(), TokenType.REFRESH);
    }

    public String issue(String subject, String email, String role, int tokenVersion, Duration ttl, TokenType tokenType) {
        Instant now = clock.instant();
        TokenClaims claims = new TokenClaims(
                subject,
                email,
                role,
                now.getEpochSecond(),
                now.plus(ttl).getEpochSecond(),
                properties.getIssuer(),
                properties.getAudience(),
                tokenType,
                UUID.randomUUID().toString(),
                tokenVersion);
        return sign(claims);
    }

    String sign(TokenClaims claims) {
        return Jwts.builder()
                .header().type("JWT").and()
                .id(claims.tokenId())
                .subject(claims.subject())
                .issuer(claims.issuer())
                .audience().single(claims.audience())
                .issuedAt(Date.from(claims.issuedAtInstant()))
                .expiration(Date.from(claims.expiresAtInstant()))
                .claim(CLAIM_EMAIL, claims.email())
                .claim(CLAIM_ROLE, claims.role())
                .claim(CLAIM_TOKEN_TYPE, claims.tokenType() == null ? null : claims.tokenType().wireName())
                .claim(CLAIM_TOKEN_VERSION, claims.tokenVersion())
                .signWith(keyFor(claims.tokenType()), Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Verifies {@code token} with the key of {@code expectedType} and returns its claims.
     *
     * @throws TokenVerificationException carrying the first check that failed
     */
    public TokenClaims verify(String token, TokenType expectedType) {
        if (token == null || !COMPACT_SHAPE.matcher(token).matches()) {
            throw new TokenVerificationException(AuthFailureReason.MALFORMED);
        }
        Claims payload;
        try {
            payload = parserFor(expectedType).parseSignedClaims(token).getPayload();
        } catch (SignatureException e) {
            throw new TokenVerificationException(AuthFailureReason.INVALID_SIGNATURE);
        } catch (ExpiredJwtException e) {
            throw new TokenVerificationException(AuthFailureReason.EXPIRED);
        } catch (InvalidClaimException e) {
            throw new TokenVerificationException(claimFailure(e.getClaimName()));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Unparseable bearer token: {}", e.getMessage());
            throw new TokenVerificationException(AuthFailureReason.MALFORMED);
        }

        TokenClaims claims = toClaims(payload);
        if (claims.tokenType() != expectedType) {
            throw new TokenVerificationException(AuthFailureReason.WRONG_TOKEN_TYPE);
        }
        return claims;
    }

    /**
     * Remaining validity of a verified token, never negative.
     */
    public Duration remainingTtl(TokenClaims claims) {
        Duration remaining = Duration.between(clock.instant(), claims.expiresAtInstant());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private JwtParser parser(SecretKey key) {
        return Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .requireIssuer(properties.getIssuer())
                .requireAudience(properties.getAudience())
                .build();
    }

    private JwtParser parserFor(TokenType tokenType) {
        return tokenType == TokenType.REFRESH ? refreshParser : accessParser;
    }

    private SecretKey keyFor(TokenType tokenType) {
        return tokenType == TokenType.REFRESH ? refreshKey : accessKey;
    }

    private static AuthFailureReason claimFailure(String claimName) {
        if (Claims.ISSUER.equals(claimName)) {
            return AuthFailureReason.ISSUER_MISMATCH;
        }
        if (Claims.AUDIENCE.equals(claimName)) {
            return AuthFailureReason.AUDIENCE_MISMATCH;
        }
        return AuthFailureReason.MALFORMED;
    }

    private static TokenClaims toClaims(Claims payload) {
        if (payload.getExpiration() == null) {
            throw new TokenVerificationException(AuthFailureReason.MALFORMED);
        }
        Set<String> audience = payload.getAudience();
        Date issuedAt = payload.getIssuedAt();
        Number tokenVersion = payload.get(CLAIM_TOKEN_VERSION, Number.class);
        return new TokenClaims(
                payload.getSubject(),
                payload.get(CLAIM_EMAIL, String.class),
                payload.get(CLAIM_ROLE, String.class),
                issuedAt == null ? 0L : issuedAt.toInstant().getEpochSecond(),
                payload.getExpiration().toInstant().getEpochSecond(),
                payload.getIssuer(),
                audience == null || audience.isEmpty() ? null : audience.iterator().next(),
                TokenType.fromWireName(payload.get(CLAIM_TOKEN_TYPE, String.class)),
                payload.getId(),
                tokenVersion == null ? 0 : tokenVersion.intValue());
    }

    private static byte[] deriveKey(byte[] accessKey) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(accessKey, "HmacSHA256"));
            return mac.doFinal(REFRESH_KEY_LABEL);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static byte[] randomKey() {
        byte[] key = new byte[64];
        new SecureRandom().nextBytes(key);
        return key;
    }
}
