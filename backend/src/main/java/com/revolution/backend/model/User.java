package com.revolution.backend.model;

import com.revolution.backend.security.BackupCodeListConverter;
import com.revolution.backend.security.SecretEncryptionConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Account record: credentials, ban state and MFA enrollment.
 */
@Entity
@Table(name = "users")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 255)
    private String email;

    @Column(length = 255)
    private String name;

    @Column(name = "password_hash", nullable = false)
    @ToString.Exclude
    private String passwordHash;

    @Column(nullable = false, length = 32)
    @Builder.Default
    private String role = "USER";

    @Column(name = "banned_at")
    private Instant bannedAt;

    @Column(name = "mfa_enabled", nullable = false)
    @Builder.Default
    private boolean mfaEnabled = false;

    // Base32 TOTP seed, encrypted at rest
    @Column(name = "mfa_secret", length = 512)
    @Convert(converter = SecretEncryptionConverter.class)
    @ToString.Exclude
    private String mfaSecret;

    // SHA-256 hashes of unused backup codes
    @Column(name = "mfa_backup_codes", length = 2048)
    @Convert(converter = BackupCodeListConverter.class)
    @ToString.Exclude
    @Builder.Default
    private List<String> mfaBackupCodes = new ArrayList<>();

    @Column(name = "mfa_enabled_at")
    private Instant mfaEnabledAt;

    // bumped to invalidate every token issued so far
    @Column(name = "token_version", nullable = false)
    @Builder.Default
    private int tokenVersion = 0;

    @Column(name = "last_login_at")
    private Instant lastLoginAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean isBanned() {
        return bannedAt != null;
    }
}
