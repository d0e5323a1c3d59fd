package com.revolution.backend.controller;

import com.revolution.backend.dto.BackupCodesResponse;
import com.revolution.backend.dto.MessageResponse;
import com.revolution.backend.dto.MfaCodeRequest;
import com.revolution.backend.dto.MfaDisableRequest;
import com.revolution.backend.dto.MfaSetupResponse;
import com.revolution.backend.security.UserPrincipal;
import com.revolution.backend.service.MfaService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import static com.revolution.backend.controller.AuthController.requireUserId;

@RestController
@RequestMapping("/api/auth/mfa")
@RequiredArgsConstructor
@Tag(name = "MFA")
@SecurityRequirement(name = "bearerAuth")
public class MfaController {

    private final MfaService mfaService;

    @PostMapping("/setup")
    @Operation(summary = "Start TOTP enrollment; returns the secret, QR code and backup codes once")
    public ResponseEntity<MfaSetupResponse> setup(@AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(mfaService.setup(requireUserId(principal)));
    }

    @PostMapping("/confirm")
    @Operation(summary = "Enable MFA by proving possession of the enrolled secret")
    public ResponseEntity<MessageResponse> confirm(@AuthenticationPrincipal UserPrincipal principal,
                                                   @Valid @RequestBody MfaCodeRequest request) {
        mfaService.confirm(requireUserId(principal), request.getCode());
        return ResponseEntity.ok(new MessageResponse("Two-factor authentication enabled"));
    }

    @PostMapping("/disable")
    @Operation(summary = "Disable MFA; requires the account password")
    public ResponseEntity<MessageResponse> disable(@AuthenticationPrincipal UserPrincipal principal,
                                                   @Valid @RequestBody MfaDisableRequest request) {
        mfaService.disable(requireUserId(principal), request.getPassword());
        return ResponseEntity.ok(new MessageResponse("Two-factor authentication disabled"));
    }

    @PostMapping("/backup-codes")
    @Operation(summary = "Replace all backup codes; requires a current TOTP code")
    public ResponseEntity<BackupCodesResponse> regenerateBackupCodes(@AuthenticationPrincipal UserPrincipal principal,
                                                                     @Valid @RequestBody MfaCodeRequest request) {
        return ResponseEntity.ok(BackupCodesResponse.builder()
                .backupCodes(mfaService.regenerateBackupCodes(requireUserId(principal), request.getCode()))
                .build());
    }
}
