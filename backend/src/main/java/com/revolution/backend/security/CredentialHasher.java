package com.revolution.backend.security;

import com.revolution.backend.config.SecurityProperties;
import com.revolution.backend.exception.WeakPasswordException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.security.crypto.bcrypt.BCrypt;
import org.springframework.stereotype.Component;

/**
 * Password hashing with Argon2id and verification across the supported {@link HashFormat}s.
 */
@Slf4j
@Component
public class CredentialHasher {

    private static final String DUMMY_PASSWORD = "dummy-password-for-timing-equalisation";
    private static final String BCRYPT_CANONICAL_PREFIX = "$2a$";

    private final Argon2PasswordEncoder argon2;
    private final SecurityProperties.Password policy;

    public CredentialHasher(SecurityProperties securityProperties) {
        this.policy = securityProperties.getPassword();
        this.argon2 = new Argon2PasswordEncoder(
                policy.getSaltLength(),
                policy.getHashLength(),
                policy.getParallelism(),
                policy.getMemoryKib(),
                policy.getIterations());
    }

    /**
     * Hashes with a fresh random salt; two calls on the same input never return the same string.
     */
    public String hash(String password) {
        return argon2.encode(password);
    }

    /**
     * @throws com.revolution.backend.exception.UnknownHashFormatException when {@code hash} matches no known format
     */
    public boolean verify(String password, String hash) {
        if (password == null) {
            return false;
        }
        HashFormat format = HashFormat.detect(hash);
        switch (format) {
            case ARGON2ID:
                return argon2.matches(password, hash);
            case BCRYPT:
                try {
                    return BCrypt.checkpw(password, normalizeBcrypt(hash));
                } catch (IllegalArgumentException e) {
                    log.warn(SecurityMarkers.SECURITY, "Corrupt legacy credential hash: {}", e.getMessage());
                    return false;
                }
            default:
                throw new IllegalStateException("No verifier for " + format);
        }
    }

    /**
     * Runs a full Argon2 computation and discards it, so an unknown account costs as much as a wrong password.
     */
    public void hashDummy() {
        argon2.encode(DUMMY_PASSWORD);
    }

    /**
     * True when {@code hash} is legacy or was produced with weaker parameters than the current ones.
     */
    public boolean needsRehash(String hash) {
        if (HashFormat.detect(hash) != HashFormat.ARGON2ID) {
            return true;
        }
        try {
            return argon2.upgradeEncoding(hash);
        } catch (IllegalArgumentException e) {
            return true;
        }
    }

    /**
     * Strength policy for new passwords. Checked before hashing so rejected input never reaches Argon2.
     */
    public void validateStrength(String password) {
        if (password == null || password.length() < policy.getMinLength()) {
            throw new WeakPasswordException("Password must be at least " + policy.getMinLength() + " characters.");
        }
        if (password.length() > policy.getMaxLength()) {
            throw new WeakPasswordException("Password must be at most " + policy.getMaxLength() + " characters.");
        }
        if (characterClasses(password) < policy.getMinCharacterClasses()) {
            throw new WeakPasswordException("Password must mix at least " + policy.getMinCharacterClasses()
                    + " of: lowercase letters, uppercase letters, digits, symbols.");
        }
    }

    static String normalizeBcrypt(String hash) {
        if (hash.startsWith("$2y$") || hash.startsWith("$2b$")) {
            return BCRYPT_CANONICAL_PREFIX + hash.substring(4);
        }
        return hash;
    }

    private static int characterClasses(String password) {
        boolean lower = false;
        boolean upper = false;
        boolean digit = false;
        boolean symbol = false;
        for (int i = 0; i < password.length(); i++) {
            char c = password.charAt(i);
            if (Character.isLowerCase(c)) {
                lower = true;
            } else if (Character.isUpperCase(c)) {
                upper = true;
            } else if (Character.isDigit(c)) {
                digit = true;
            } else if (!Character.isWhitespace(c)) {
                symbol = true;
            }
        }
        int classes = 0;
        if (lower) classes++;
        if (upper) classes++;
        if (digit) classes++;
        if (symbol) classes++;
        return classes;
    }
}
