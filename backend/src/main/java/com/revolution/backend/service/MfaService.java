package com.revolution.backend.service;

import com.revolution.backend.config.SecurityProperties;
import com.revolution.backend.dto.MfaSetupResponse;
import com.revolution.backend.exception.AuthFailureReason;
import com.revolution.backend.exception.AuthenticationFailedException;
import com.revolution.backend.exception.BadRequestException;
import com.revolution.backend.exception.ConflictException;
import com.revolution.backend.model.SecurityEventType;
import com.revolution.backend.model.User;
import com.revolution.backend.repository.UserRepository;
import com.revolution.backend.security.BackupCodes;
import com.revolution.backend.security.CredentialHasher;
import com.revolution.backend.security.SecurityMarkers;
import com.revolution.backend.security.TotpVerifier;
import dev.samstevens.totp.code.HashingAlgorithm;
import dev.samstevens.totp.exceptions.QrGenerationException;
import dev.samstevens.totp.qr.QrData;
import dev.samstevens.totp.qr.QrGenerator;
import dev.samstevens.totp.qr.ZxingPngQrGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static dev.samstevens.totp.util.Utils.getDataUriForImage;

/**
 * TOTP enrollment lifecycle and backup-code consumption.
 *
 * <p>Setup stores a pending secret; MFA only becomes active once a code generated from it is confirmed.
 */
@Slf4j
@Service
public class MfaService {

    private final UserRepository userRepository;
    private final TotpVerifier totpVerifier;
    private final CredentialHasher credentialHasher;
    private final CredentialWorkPool credentialWorkPool;
    private final SecurityEventService securityEventService;
    private final Clock clock;
    private final String issuer;
    private final QrGenerator qrGenerator = new ZxingPngQrGenerator();

    public MfaService(UserRepository userRepository,
                      TotpVerifier totpVerifier,
                      CredentialHasher credentialHasher,
                      CredentialWorkPool credentialWorkPool,
                      SecurityEventService securityEventService,
                      SecurityProperties securityProperties,
                      Clock clock) {
        this.userRepository = userRepository;
        this.totpVerifier = totpVerifier;
        this.credentialHasher = credentialHasher;
        this.credentialWorkPool = credentialWorkPool;
        this.securityEventService = securityEventService;
        this.issuer = securityProperties.getMfa().getIssuer();
        this.clock = clock;
    }

    @Transactional
    public MfaSetupResponse setup(Long userId) {
        User user = lockUser(userId);
        if (user.isMfaEnabled()) {
            throw new ConflictException("Two-factor authentication is already enabled.");
        }
        String secret = totpVerifier.generateSecret();
        BackupCodes backupCodes = totpVerifier.generateBackupCodes();
        user.setMfaSecret(secret);
        user.setMfaBackupCodes(new ArrayList<>(backupCodes.hashedCodes()));
        userRepository.save(user);

        QrData qrData = new QrData.Builder()
                .label(user.getEmail())
                .secret(secret)
                .issuer(issuer)
                .algorithm(HashingAlgorithm.SHA1)
                .digits(TotpVerifier.DIGITS)
                .period(TotpVerifier.PERIOD_SECONDS)
                .build();

        securityEventService.record(userId, SecurityEventType.MFA_SETUP_INITIATED);
        return MfaSetupResponse.builder()
                .secret(secret)
                .otpauthUri(qrData.getUri())
                .qrCode(renderQr(qrData))
                .backupCodes(backupCodes.plainCodes())
                .build();
    }

    @Transactional
    public void confirm(Long userId, String code) {
        User user = lockUser(userId);
        if (user.isMfaEnabled()) {
            throw new ConflictException("Two-factor authentication is already enabled.");
        }
        if (user.getMfaSecret() == null) {
            throw new BadRequestException("Two-factor setup has not been started.");
        }
        if (!totpVerifier.verify(user.getMfaSecret(), code)) {
            securityEventService.record(userId, SecurityEventType.MFA_CODE_FAILED);
            throw new BadRequestException("Invalid verification code.");
        }
        user.setMfaEnabled(true);
        user.setMfaEnabledAt(clock.instant());
        userRepository.save(user);
        securityEventService.record(userId, SecurityEventType.MFA_ENABLED);
        log.info(SecurityMarkers.SECURITY, "MFA enabled for account {}", userId);
    }

    @Transactional
    public void disable(Long userId, String password) {
        User user = lockUser(userId);
        if (!user.isMfaEnabled()) {
            throw new BadRequestException("Two-factor authentication is not enabled.");
        }
        boolean matches = credentialWorkPool.run(() -> credentialHasher.verify(password, user.getPasswordHash()));
        if (!matches) {
            throw new BadRequestException("Password is incorrect.");
        }
        user.setMfaEnabled(false);
        user.setMfaSecret(null);
        user.setMfaBackupCodes(new ArrayList<>());
        user.setMfaEnabledAt(null);
        userRepository.save(user);
        securityEventService.record(userId, SecurityEventType.MFA_DISABLED);
        log.info(SecurityMarkers.SECURITY, "MFA disabled for account {}", userId);
    }

    /**
     * Replaces every stored backup code. Requires a current TOTP code.
     */
    @Transactional
    public List<String> regenerateBackupCodes(Long userId, String code) {
        User user = lockUser(userId);
        if (!user.isMfaEnabled()) {
            throw new BadRequestException("Two-factor authentication is not enabled.");
        }
        if (!totpVerifier.verify(user.getMfaSecret(), code)) {
            securityEventService.record(userId, SecurityEventType.MFA_CODE_FAILED);
            throw new BadRequestException("Invalid verification code.");
        }
        BackupCodes backupCodes = totpVerifier.generateBackupCodes();
        user.setMfaBackupCodes(new ArrayList<>(backupCodes.hashedCodes()));
        userRepository.save(user);
        securityEventService.record(userId, SecurityEventType.BACKUP_CODES_REGENERATED);
        return backupCodes.plainCodes();
    }

    /**
     * Matches {@code code} against the stored hashes and removes the match in the same transaction, under a
     * row lock, so two concurrent logins cannot spend one code twice.
     */
    @Transactional
    public boolean consumeBackupCode(Long userId, String code) {
        User user = lockUser(userId);
        List<String> stored = user.getMfaBackupCodes();
        OptionalInt match = totpVerifier.verifyBackupCode(code, stored);
        if (match.isEmpty()) {
            return false;
        }
        List<String> remaining = new ArrayList<>(stored);
        remaining.remove(match.getAsInt());
        user.setMfaBackupCodes(remaining);
        userRepository.save(user);
        log.info(SecurityMarkers.SECURITY, "Backup code used for account {}, {} remaining", userId, remaining.size());
        return true;
    }

    private User lockUser(Long userId) {
        return userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new AuthenticationFailedException(AuthFailureReason.USER_NOT_FOUND));
    }

    private String renderQr(QrData qrData) {
        try {
            return getDataUriForImage(qrGenerator.generate(qrData), qrGenerator.getImageMimeType());
        } catch (QrGenerationException e) {
            log.warn("QR rendering failed, returning otpauth URI only: {}", e.getMessage());
            return null;
        }
    }
}
