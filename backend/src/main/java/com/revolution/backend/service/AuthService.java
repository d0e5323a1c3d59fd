package com.revolution.backend.service;

import com.revolution.backend.config.JwtProperties;
import com.revolution.backend.dto.AuthResponse;
import com.revolution.backend.dto.ChangePasswordRequest;
import com.revolution.backend.dto.LoginRequest;
import com.revolution.backend.dto.LogoutRequest;
import com.revolution.backend.dto.RefreshRequest;
import com.revolution.backend.dto.UserProfileDTO;
import com.revolution.backend.exception.AuthFailureReason;
import com.revolution.backend.exception.AuthenticationFailedException;
import com.revolution.backend.exception.BadRequestException;
import com.revolution.backend.exception.RateLimitedException;
import com.revolution.backend.exception.ServiceBusyException;
import com.revolution.backend.exception.TokenVerificationException;
import com.revolution.backend.exception.UnknownHashFormatException;
import com.revolution.backend.model.SecurityEventType;
import com.revolution.backend.model.User;
import com.revolution.backend.repository.UserRepository;
import com.revolution.backend.security.AuthPipeline;
import com.revolution.backend.security.CredentialHasher;
import com.revolution.backend.security.LoginRateLimiter;
import com.revolution.backend.security.RateLimitDecision;
import com.revolution.backend.security.RestAuthenticationEntryPoint;
import com.revolution.backend.security.RevocationStore;
import com.revolution.backend.security.SecurityMarkers;
import com.revolution.backend.security.TokenClaims;
import com.revolution.backend.security.TokenCodec;
import com.revolution.backend.security.TokenType;
import com.revolution.backend.security.TotpVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Login, token refresh, logout and password change.
 *
 * <p>Every credential failure (unknown account, wrong password, bad second factor) leaves through the same
 * {@link AuthenticationFailedException}; the reason is for logs and metrics only. Failed attempts are
 * charged to both the client address and the account.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    static final String MFA_REQUIRED_MESSAGE = "Two-factor authentication code required.";

    private final UserRepository userRepository;
    private final CredentialHasher credentialHasher;
    private final CredentialWorkPool credentialWorkPool;
    private final TokenCodec tokenCodec;
    private final RevocationStore revocationStore;
    private final LoginRateLimiter loginRateLimiter;
    private final TotpVerifier totpVerifier;
    private final MfaService mfaService;
    private final SecurityEventService securityEventService;
    private final SecurityMetrics securityMetrics;
    private final JwtProperties jwtProperties;
    private final Clock clock;

    public LoginResult login(LoginRequest request, String clientIp) {
        String email = JpaPrincipalStore.normalizeEmail(request.getEmail());
        String ipKey = ipKey(clientIp);
        String accountKey = accountKey(email);

        RateLimitDecision accountDecision = loginRateLimiter.check(accountKey);
        if (!accountDecision.isAllowed()) {
            // refused attempts still count, so sustained pressure on one account escalates to a lockout
            RateLimitDecision escalated = loginRateLimiter.recordAttempt(accountKey);
            RateLimitDecision decision = escalated.isAllowed() ? accountDecision : escalated;
            securityMetrics.recordRateLimitRejection(decision.status());
            throw new RateLimitedException(decision);
        }

        Optional<User> found = userRepository.findByEmail(email);
        if (found.isEmpty()) {
            credentialWorkPool.execute(credentialHasher::hashDummy);
            throw failure(null, ipKey, accountKey, AuthFailureReason.USER_NOT_FOUND, SecurityEventType.LOGIN_FAILED);
        }
        User user = found.get();

        boolean matches;
        try {
            matches = credentialWorkPool.run(() -> credentialHasher.verify(request.getPassword(), user.getPasswordHash()));
        } catch (UnknownHashFormatException e) {
            log.error(SecurityMarkers.SECURITY, "Account {} has a credential hash in an unknown format", user.getId());
            throw failure(user.getId(), ipKey, accountKey, AuthFailureReason.UNKNOWN_HASH_FORMAT, SecurityEventType.LOGIN_FAILED);
        }
        if (!matches) {
            throw failure(user.getId(), ipKey, accountKey, AuthFailureReason.INVALID_CREDENTIALS, SecurityEventType.LOGIN_FAILED);
        }

        if (user.isBanned()) {
            securityMetrics.recordAuthFailure(AuthFailureReason.USER_BANNED);
            log.warn(SecurityMarkers.SECURITY, "Login refused for suspended account {}", user.getId());
            throw new AuthenticationFailedException(AuthFailureReason.USER_BANNED, RestAuthenticationEntryPoint.BANNED_MESSAGE);
        }

        if (user.isMfaEnabled()) {
            String code = trimToNull(request.getCode());
            String backupCode = trimToNull(request.getBackupCode());
            if (code == null && backupCode == null) {
                securityMetrics.recordAuthFailure(AuthFailureReason.MFA_REQUIRED);
                securityEventService.record(user.getId(), SecurityEventType.LOGIN_MFA_REQUIRED);
                return LoginResult.mfaRequired(MFA_REQUIRED_MESSAGE);
            }
            if (code != null) {
                if (!totpVerifier.verify(user.getMfaSecret(), code)) {
                    throw failure(user.getId(), ipKey, accountKey, AuthFailureReason.MFA_INVALID, SecurityEventType.MFA_CODE_FAILED);
                }
            } else {
                if (!mfaService.consumeBackupCode(user.getId(), backupCode)) {
                    throw failure(user.getId(), ipKey, accountKey, AuthFailureReason.MFA_INVALID, SecurityEventType.MFA_BACKUP_CODE_FAILED);
                }
                securityEventService.record(user.getId(), SecurityEventType.MFA_BACKUP_CODE_USED);
            }
        }

        // the address window is left to expire: one owned account must not reset throttling for others
        loginRateLimiter.clear(accountKey);
        rehashIfNeeded(user, request.getPassword());
        userRepository.updateLastLoginAt(user.getId(), clock.instant());
        securityEventService.record(user.getId(), SecurityEventType.LOGIN);
        log.info(SecurityMarkers.SECURITY, "Login succeeded for account {}", user.getId());
        return LoginResult.issued(issueTokens(user));
    }

    public AuthResponse refresh(RefreshRequest request) {
        String presented = request.getRefreshToken();
        TokenClaims claims;
        try {
            if (revocationStore.isRevoked(presented)) {
                throw new TokenVerificationException(AuthFailureReason.REVOKED);
            }
            claims = tokenCodec.verify(presented, TokenType.REFRESH);
            if (jwtProperties.isRotateRefreshTokens() && !consume(presented, claims)) {
                // another request already exchanged this token
                throw new TokenVerificationException(AuthFailureReason.REVOKED);
            }
        } catch (TokenVerificationException e) {
            securityMetrics.recordAuthFailure(e.getReason());
            log.debug("Refresh rejected: reason={}", e.getReason());
            throw e;
        }

        Long userId = parseSubject(claims.subject());
        User user = userRepository.findById(userId).orElseThrow(() -> {
            securityMetrics.recordAuthFailure(AuthFailureReason.USER_NOT_FOUND);
            return new AuthenticationFailedException(AuthFailureReason.USER_NOT_FOUND);
        });
        if (user.isBanned()) {
            securityMetrics.recordAuthFailure(AuthFailureReason.USER_BANNED);
            throw new AuthenticationFailedException(AuthFailureReason.USER_BANNED, RestAuthenticationEntryPoint.BANNED_MESSAGE);
        }
        if (claims.tokenVersion() != user.getTokenVersion()) {
            securityMetrics.recordAuthFailure(AuthFailureReason.REVOKED);
            throw new TokenVerificationException(AuthFailureReason.REVOKED);
        }

        String subject = String.valueOf(user.getId());
        String accessToken = tokenCodec.issueAccessToken(subject, user.getEmail(), user.getRole(), user.getTokenVersion());
        String refreshToken = presented;
        if (jwtProperties.isRotateRefreshTokens()) {
            refreshToken = tokenCodec.issueRefreshToken(subject, user.getEmail(), user.getRole(), user.getTokenVersion());
        }
        securityEventService.record(user.getId(), SecurityEventType.TOKEN_REFRESHED);
        return buildResponse(user, accessToken, refreshToken);
    }

    /**
     * Revokes the presented access token and, when given, the refresh token. Tokens that fail verification
     * are ignored, so repeating a logout or logging out with an expired token still succeeds.
     */
    public void logout(String authorizationHeader, LogoutRequest request) {
        Long userId = null;
        String accessToken = AuthPipeline.extractBearer(authorizationHeader);
        if (accessToken != null) {
            userId = revokeIfSigned(accessToken, TokenType.ACCESS);
        }
        String refreshToken = request == null ? null : trimToNull(request.getRefreshToken());
        if (refreshToken != null) {
            Long refreshOwner = revokeIfSigned(refreshToken, TokenType.REFRESH);
            if (userId == null) {
                userId = refreshOwner;
            }
        }
        if (userId != null) {
            securityEventService.record(userId, SecurityEventType.LOGOUT);
        }
    }

    /**
     * Invalidates every access and refresh token issued to the account so far, including the one presented.
     */
    public void logoutAll(Long userId, String authorizationHeader) {
        User user = loadUser(userId);
        userRepository.incrementTokenVersion(user.getId());
        String accessToken = AuthPipeline.extractBearer(authorizationHeader);
        if (accessToken != null) {
            revokeIfSigned(accessToken, TokenType.ACCESS);
        }
        securityEventService.record(user.getId(), SecurityEventType.LOGOUT_ALL);
        log.info(SecurityMarkers.SECURITY, "All sessions revoked for account {}", user.getId());
    }

    public UserProfileDTO currentUser(Long userId) {
        return toProfile(loadUser(userId));
    }

    public void changePassword(Long userId, ChangePasswordRequest request) {
        User user = loadUser(userId);
        boolean matches = credentialWorkPool.run(
                () -> credentialHasher.verify(request.getCurrentPassword(), user.getPasswordHash()));
        if (!matches) {
            securityMetrics.recordAuthFailure(AuthFailureReason.INVALID_CREDENTIALS);
            throw new BadRequestException("Current password is incorrect.");
        }
        if (request.getCurrentPassword().equals(request.getNewPassword())) {
            throw new BadRequestException("New password must differ from the current password.");
        }
        credentialHasher.validateStrength(request.getNewPassword());
        String hash = credentialWorkPool.run(() -> credentialHasher.hash(request.getNewPassword()));
        userRepository.updatePasswordHash(user.getId(), hash);
        securityEventService.record(user.getId(), SecurityEventType.PASSWORD_CHANGED);
        log.info(SecurityMarkers.SECURITY, "Password changed for account {}", user.getId());
    }

    public static UserProfileDTO toProfile(User user) {
        return UserProfileDTO.builder()
                .id(user.getId())
                .email(user.getEmail())
                .name(user.getName())
                .role(user.getRole())
                .mfaEnabled(user.isMfaEnabled())
                .lastLoginAt(user.getLastLoginAt())
                .build();
    }

    static String ipKey(String clientIp) {
        return "ip:" + (clientIp == null ? "unknown" : clientIp);
    }

    static String accountKey(String email) {
        return "account:" + email;
    }

    private AuthenticationFailedException failure(Long userId, String ipKey, String accountKey,
                                                  AuthFailureReason reason, SecurityEventType eventType) {
        securityMetrics.recordAuthFailure(reason);
        loginRateLimiter.recordFailure(ipKey);
        RateLimitDecision accountDecision = loginRateLimiter.recordFailure(accountKey);
        log.info(SecurityMarkers.SECURITY, "Login failed for {} from {}: reason={}", accountKey, ipKey, reason);
        if (userId != null) {
            securityEventService.record(userId, eventType);
            if (accountDecision.status() == RateLimitDecision.Status.LOCKED) {
                securityEventService.record(userId, SecurityEventType.ACCOUNT_LOCKED);
            }
        }
        return new AuthenticationFailedException(reason);
    }

    private void rehashIfNeeded(User user, String password) {
        if (!credentialHasher.needsRehash(user.getPasswordHash())) {
            return;
        }
        try {
            String upgraded = credentialWorkPool.run(() -> credentialHasher.hash(password));
            userRepository.updatePasswordHash(user.getId(), upgraded);
            log.info(SecurityMarkers.SECURITY, "Upgraded credential hash for account {}", user.getId());
        } catch (ServiceBusyException e) {
            log.warn("Deferred credential rehash for account {}: {}", user.getId(), e.getMessage());
        }
    }

    private AuthResponse issueTokens(User user) {
        String subject = String.valueOf(user.getId());
        String accessToken = tokenCodec.issueAccessToken(subject, user.getEmail(), user.getRole(), user.getTokenVersion());
        String refreshToken = tokenCodec.issueRefreshToken(subject, user.getEmail(), user.getRole(), user.getTokenVersion());
        return buildResponse(user, accessToken, refreshToken);
    }

    private AuthResponse buildResponse(User user, String accessToken, String refreshToken) {
        TokenClaims accessClaims = tokenCodec.verify(accessToken, TokenType.ACCESS);
        return AuthResponse.builder()
                .token(accessToken)
                .refreshToken(refreshToken)
                .expiresAt(accessClaims.expiresAtInstant())
                .user(toProfile(user))
                .build();
    }

    private Long revokeIfSigned(String token, TokenType type) {
        TokenClaims claims;
        try {
            claims = tokenCodec.verify(token, type);
        } catch (TokenVerificationException e) {
            log.debug("Logout skipped {} token: reason={}", type, e.getReason());
            return null;
        }
        revoke(token, claims);
        try {
            return Long.valueOf(claims.subject());
        } catch (NumberFormatException e) {
            log.debug("Logout token carries non-numeric subject");
            return null;
        }
    }

    private void revoke(String token, TokenClaims claims) {
        if (revocationStore.revoke(token, tokenCodec.remainingTtl(claims))) {
            securityMetrics.recordRevocation();
        }
    }

    /**
     * Single-use exchange of a refresh token: only the caller that revokes it first may proceed.
     */
    private boolean consume(String token, TokenClaims claims) {
        Duration remaining = tokenCodec.remainingTtl(claims);
        boolean consumed = revocationStore.revoke(token, remaining.isZero() ? Duration.ofSeconds(1) : remaining);
        if (consumed) {
            securityMetrics.recordRevocation();
        }
        return consumed;
    }

    private User loadUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new AuthenticationFailedException(AuthFailureReason.USER_NOT_FOUND));
    }

    private Long parseSubject(String subject) {
        if (subject != null) {
            try {
                return Long.valueOf(subject);
            } catch (NumberFormatException e) {
                log.debug("Refresh token carries non-numeric subject");
            }
        }
        securityMetrics.recordAuthFailure(AuthFailureReason.MALFORMED);
        throw new TokenVerificationException(AuthFailureReason.MALFORMED);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
