package com.revolution.backend.controller;

import com.revolution.backend.dto.AuthResponse;
import com.revolution.backend.dto.ChangePasswordRequest;
import com.revolution.backend.dto.LoginRequest;
import com.revolution.backend.dto.LogoutRequest;
import com.revolution.backend.dto.MessageResponse;
import com.revolution.backend.dto.RefreshRequest;
import com.revolution.backend.dto.SecurityEventDTO;
import com.revolution.backend.dto.UserProfileDTO;
import com.revolution.backend.exception.AuthFailureReason;
import com.revolution.backend.exception.AuthenticationFailedException;
import com.revolution.backend.security.ClientAddressResolver;
import com.revolution.backend.security.UserPrincipal;
import com.revolution.backend.service.AuthService;
import com.revolution.backend.service.LoginResult;
import com.revolution.backend.service.SecurityEventService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Tag(name = "Auth")
public class AuthController {

    private final AuthService authService;
    private final SecurityEventService securityEventService;
    private final ClientAddressResolver clientAddressResolver;

    @PostMapping("/login")
    @Operation(summary = "Exchange credentials (and a second factor when enabled) for tokens")
    public ResponseEntity<Object> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        LoginResult result = authService.login(request, clientAddressResolver.resolve(httpRequest));
        if (result.isMfaRequired()) {
            return ResponseEntity.ok(result.mfaChallenge());
        }
        return ResponseEntity.ok(result.tokens());
    }

    @PostMapping("/refresh")
    @Operation(summary = "Exchange a refresh token for a new token pair")
    public ResponseEntity<AuthResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request));
    }

    @PostMapping("/logout")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Revoke the presented access token and optional refresh token")
    public ResponseEntity<MessageResponse> logout(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) LogoutRequest request) {
        authService.logout(authorization, request);
        return ResponseEntity.ok(new MessageResponse("Logged out"));
    }

    @PostMapping("/logout-all")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Revoke every session of the current account")
    public ResponseEntity<MessageResponse> logoutAll(
            @AuthenticationPrincipal UserPrincipal principal,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        authService.logoutAll(requireUserId(principal), authorization);
        return ResponseEntity.ok(new MessageResponse("Logged out of all sessions"));
    }

    @GetMapping("/me")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Current account profile")
    public ResponseEntity<UserProfileDTO> me(@AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(authService.currentUser(requireUserId(principal)));
    }

    @PostMapping("/password")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Change password")
    public ResponseEntity<MessageResponse> changePassword(@AuthenticationPrincipal UserPrincipal principal,
                                                          @Valid @RequestBody ChangePasswordRequest request) {
        authService.changePassword(requireUserId(principal), request);
        return ResponseEntity.ok(new MessageResponse("Password changed"));
    }

    @GetMapping("/security-events")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Recent security events for the current account")
    public ResponseEntity<List<SecurityEventDTO>> securityEvents(@AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(securityEventService.recentEvents(requireUserId(principal)));
    }

    static Long requireUserId(UserPrincipal principal) {
        if (principal == null || principal.getUserId() == null) {
            throw new AuthenticationFailedException(AuthFailureReason.MALFORMED, "Missing authentication");
        }
        return principal.getUserId();
    }
}
