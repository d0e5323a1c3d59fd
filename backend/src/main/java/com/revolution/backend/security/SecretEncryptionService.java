package com.revolution.backend.security;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.stream.Stream;

/**
 * AES-256-GCM for secrets kept in database columns (TOTP seeds).
 *
 * <p>Stored form is {@code enc:v1:} followed by Base64 of {@code iv || ciphertext || tag}; the version prefix is
 * also bound as associated data. The key comes from {@code SECURITY_TOKEN_ENCRYPTION_KEY}, falling back to
 * {@code security.token-encryption-key}. Without a key values are stored as given, which the prod profile refuses.
 */
@Slf4j
@Service
public class SecretEncryptionService {

    static final String PREFIX = "enc:v1:";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final byte[] ASSOCIATED_DATA = PREFIX.getBytes(StandardCharsets.US_ASCII);
    private static final int KEY_BYTES = 32;
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final Environment environment;
    private final SecureRandom random = new SecureRandom();

    private volatile SecretKey key;

    public SecretEncryptionService(Environment environment) {
        this.environment = environment;
    }

    @PostConstruct
    public void init() {
        String encoded = Stream.of("SECURITY_TOKEN_ENCRYPTION_KEY", "security.token-encryption-key")
                .map(environment::getProperty)
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .orElse(null);
        if (encoded == null) {
            if (Arrays.stream(environment.getActiveProfiles()).anyMatch(SecretEncryptionService::isProdProfile)) {
                throw new IllegalStateException("SECURITY_TOKEN_ENCRYPTION_KEY is required in production");
            }
            log.warn("SECURITY_TOKEN_ENCRYPTION_KEY not set; MFA secrets will be stored unencrypted");
            key = null;
            return;
        }
        key = new SecretKeySpec(decodeKey(encoded.trim()), "AES");
    }

    /**
     * Blank and already encrypted values are returned unchanged.
     */
    public String encrypt(String plain) {
        if (plain == null || plain.isBlank() || looksEncrypted(plain) || key == null) {
            return plain;
        }
        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(iv);
        try {
            byte[] sealed = cipher(Cipher.ENCRYPT_MODE, iv).doFinal(plain.getBytes(StandardCharsets.UTF_8));
            byte[] payload = ByteBuffer.allocate(IV_BYTES + sealed.length).put(iv).put(sealed).array();
            return PREFIX + Base64.getEncoder().encodeToString(payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt secret", e);
        }
    }

    /**
     * Values without the prefix are returned unchanged. An encrypted value that cannot be opened is an error.
     */
    public String decrypt(String stored) {
        if (stored == null || !looksEncrypted(stored)) {
            return stored;
        }
        if (key == null) {
            throw new IllegalStateException("Encrypted secret found but SECURITY_TOKEN_ENCRYPTION_KEY is not configured");
        }
        try {
            ByteBuffer payload = ByteBuffer.wrap(Base64.getDecoder().decode(stored.substring(PREFIX.length())));
            if (payload.remaining() < IV_BYTES + TAG_BITS / 8) {
                throw new IllegalStateException("Encrypted secret is truncated");
            }
            byte[] iv = new byte[IV_BYTES];
            payload.get(iv);
            byte[] sealed = new byte[payload.remaining()];
            payload.get(sealed);
            return new String(cipher(Cipher.DECRYPT_MODE, iv).doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to decrypt secret; check SECURITY_TOKEN_ENCRYPTION_KEY", e);
        }
    }

    public boolean looksEncrypted(String value) {
        return value != null && value.startsWith(PREFIX);
    }

    public boolean isEnabled() {
        return key != null;
    }

    private Cipher cipher(int mode, byte[] iv) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(mode, key, new GCMParameterSpec(TAG_BITS, iv));
        cipher.updateAAD(ASSOCIATED_DATA);
        return cipher;
    }

    private static byte[] decodeKey(String encoded) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("SECURITY_TOKEN_ENCRYPTION_KEY is not valid Base64", e);
        }
        if (bytes.length != KEY_BYTES) {
            throw new IllegalStateException("SECURITY_TOKEN_ENCRYPTION_KEY must decode to " + KEY_BYTES
                    + " bytes, got " + bytes.length);
        }
        return bytes;
    }

    private static boolean isProdProfile(String profile) {
        return "prod".equalsIgnoreCase(profile) || "production".equalsIgnoreCase(profile);
    }
}
