package com.revolution.backend.security;

import com.revolution.backend.config.SecurityProperties;
import dev.samstevens.totp.code.CodeGenerator;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.code.DefaultCodeVerifier;
import dev.samstevens.totp.code.HashingAlgorithm;
import dev.samstevens.totp.exceptions.CodeGenerationException;
import dev.samstevens.totp.secret.DefaultSecretGenerator;
import dev.samstevens.totp.secret.SecretGenerator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Base32;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * RFC 6238 TOTP (HMAC-SHA1, 6 digits, 30 second steps) and single-use backup codes.
 *
 * <p>Codes are accepted for the current step and one step either side. Widening that window raises the
 * brute-force budget per code.
 */
@Slf4j
@Component
public class TotpVerifier {

    public static final int DIGITS = 6;
    public static final int PERIOD_SECONDS = 30;
    static final int DRIFT_STEPS = 1;

    private static final int SECRET_CHARACTERS = 32;
    private static final Pattern CODE_PATTERN = Pattern.compile("\\d{" + DIGITS + "}");
    private static final Pattern BASE32_PATTERN = Pattern.compile("[A-Z2-7]+");
    private static final char[] BACKUP_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789".toCharArray();

    private final Clock clock;
    private final SecurityProperties.Mfa mfa;
    private final SecureRandom random = new SecureRandom();
    private final Base32 base32 = new Base32();
    private final SecretGenerator secretGenerator = new DefaultSecretGenerator(SECRET_CHARACTERS);
    private final CodeGenerator codeGenerator = new DefaultCodeGenerator(HashingAlgorithm.SHA1, DIGITS);

    public TotpVerifier(Clock clock, SecurityProperties securityProperties) {
        this.clock = clock;
        this.mfa = securityProperties.getMfa();
    }

    public boolean verify(String base32Secret, String code) {
        return verify(base32Secret, code, clock.instant());
    }

    public boolean verify(String base32Secret, String code, Instant at) {
        if (code == null || !CODE_PATTERN.matcher(code).matches()) {
            return false;
        }
        String secret;
        try {
            secret = normalizeSecret(base32Secret);
        } catch (IllegalArgumentException e) {
            log.warn(SecurityMarkers.SECURITY, "Stored TOTP secret is not valid base32");
            return false;
        }
        DefaultCodeVerifier codeVerifier = new DefaultCodeVerifier(codeGenerator, at::getEpochSecond);
        codeVerifier.setTimePeriod(PERIOD_SECONDS);
        codeVerifier.setAllowedTimePeriodDiscrepancy(DRIFT_STEPS);
        return codeVerifier.isValidCode(secret, code);
    }

    public String generateCode(String base32Secret, Instant at) {
        try {
            return codeGenerator.generate(normalizeSecret(base32Secret), timeStep(at));
        } catch (CodeGenerationException e) {
            throw new IllegalStateException("Failed to generate TOTP code", e);
        }
    }

    /**
     * 160 random bits, base32 encoded without padding.
     */
    public String generateSecret() {
        return secretGenerator.generate();
    }

    public byte[] decodeSecret(String base32Secret) {
        return base32.decode(normalizeSecret(base32Secret));
    }

    static String normalizeSecret(String base32Secret) {
        if (base32Secret == null) {
            throw new IllegalArgumentException("Missing secret");
        }
        String normalized = base32Secret.replace(" ", "").replace("=", "").toUpperCase(Locale.ROOT);
        if (normalized.isEmpty() || !BASE32_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Secret is not base32");
        }
        return normalized;
    }

    public BackupCodes generateBackupCodes() {
        return generateBackupCodes(mfa.getBackupCodeCount());
    }

    public BackupCodes generateBackupCodes(int count) {
        int length = mfa.getBackupCodeLength();
        List<String> plain = new ArrayList<>(count);
        List<String> hashed = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            StringBuilder code = new StringBuilder(length + 1);
            for (int c = 0; c < length; c++) {
                if (c == length / 2) {
                    code.append('-');
                }
                code.append(BACKUP_ALPHABET[random.nextInt(BACKUP_ALPHABET.length)]);
            }
            plain.add(code.toString());
            hashed.add(hashBackupCode(code.toString()));
        }
        return new BackupCodes(List.copyOf(plain), List.copyOf(hashed));
    }

    /**
     * Index of the stored hash matching {@code code}. Every stored hash is compared; consuming the match is
     * left to the caller.
     */
    public OptionalInt verifyBackupCode(String code, List<String> hashedCodes) {
        if (code == null || hashedCodes == null || hashedCodes.isEmpty()) {
            return OptionalInt.empty();
        }
        String normalized = normalizeBackupCode(code);
        if (normalized.isEmpty()) {
            return OptionalInt.empty();
        }
        byte[] presented = hashBackupCode(normalized).getBytes(StandardCharsets.US_ASCII);
        int match = -1;
        for (int i = 0; i < hashedCodes.size(); i++) {
            String stored = hashedCodes.get(i);
            byte[] candidate = stored == null ? new byte[0] : stored.getBytes(StandardCharsets.US_ASCII);
            if (MessageDigest.isEqual(candidate, presented) && match < 0) {
                match = i;
            }
        }
        return match < 0 ? OptionalInt.empty() : OptionalInt.of(match);
    }

    public String hashBackupCode(String code) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(normalizeBackupCode(code).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to hash backup code", e);
        }
    }

    static String normalizeBackupCode(String code) {
        StringBuilder normalized = new StringBuilder(code.length());
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                normalized.append(Character.toUpperCase(c));
            }
        }
        return normalized.toString();
    }

    static long timeStep(Instant at) {
        return Math.floorDiv(at.getEpochSecond(), PERIOD_SECONDS);
    }
}
