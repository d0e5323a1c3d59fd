package com.revolution.backend.security;

import com.revolution.backend.config.SecurityProperties;
import com.revolution.backend.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TotpVerifierTest {

    // "12345678901234567890" in base32, the RFC 6238 SHA-1 test key
    private static final String RFC_SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";

    private MutableClock clock;
    private TotpVerifier verifier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:15Z"));
        verifier = new TotpVerifier(clock, new SecurityProperties());
    }

    @Test
    void referenceSecretDecodesToHello() {
        byte[] decoded = verifier.decodeSecret("JBSWY3DPEHPK3PXP");

        assertThat(Arrays.copyOf(decoded, 6)).isEqualTo("Hello!".getBytes(StandardCharsets.US_ASCII));
        assertThat(decoded).hasSize(10);
    }

    @Test
    void secretDecodingIgnoresCaseSpacesAndPadding() {
        assertThat(verifier.decodeSecret("jbsw y3dp ehpk 3pxp"))
                .isEqualTo(verifier.decodeSecret("JBSWY3DPEHPK3PXP"));
        assertThat(verifier.decodeSecret("JBSWY3DPEHPK3PXP======"))
                .isEqualTo(verifier.decodeSecret("JBSWY3DPEHPK3PXP"));
        assertThatThrownBy(() -> verifier.decodeSecret("NOT-BASE32!")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void matchesRfc6238Vectors() {
        assertThat(verifier.generateCode(RFC_SECRET, Instant.ofEpochSecond(59))).isEqualTo("287082");
        assertThat(verifier.generateCode(RFC_SECRET, Instant.ofEpochSecond(1111111109))).isEqualTo("081804");
        assertThat(verifier.generateCode(RFC_SECRET, Instant.ofEpochSecond(1234567890))).isEqualTo("005924");
        assertThat(verifier.generateCode(RFC_SECRET, Instant.ofEpochSecond(2000000000))).isEqualTo("279037");
    }

    @Test
    void codeIsAcceptedOneStepEitherSide() {
        Instant t = clock.instant();
        String code = verifier.generateCode(RFC_SECRET, t);

        assertThat(verifier.verify(RFC_SECRET, code, t.minusSeconds(30))).isTrue();
        assertThat(verifier.verify(RFC_SECRET, code, t)).isTrue();
        assertThat(verifier.verify(RFC_SECRET, code, t.plusSeconds(30))).isTrue();
        assertThat(verifier.verify(RFC_SECRET, code, t.minusSeconds(61))).isFalse();
        assertThat(verifier.verify(RFC_SECRET, code, t.plusSeconds(61))).isFalse();
    }

    @Test
    void verifyUsesTheInjectedClock() {
        String code = verifier.generateCode(RFC_SECRET, clock.instant());

        assertThat(verifier.verify(RFC_SECRET, code)).isTrue();
        clock.advance(Duration.ofMinutes(5));
        assertThat(verifier.verify(RFC_SECRET, code)).isFalse();
    }

    @Test
    void malformedCodesAreRejectedWithoutComputation() {
        assertThat(verifier.verify(RFC_SECRET, null)).isFalse();
        assertThat(verifier.verify(RFC_SECRET, "")).isFalse();
        assertThat(verifier.verify(RFC_SECRET, "12345")).isFalse();
        assertThat(verifier.verify(RFC_SECRET, "1234567")).isFalse();
        assertThat(verifier.verify(RFC_SECRET, "12a456")).isFalse();
        assertThat(verifier.verify(RFC_SECRET, " 123456")).isFalse();
    }

    @Test
    void invalidStoredSecretFailsClosed() {
        assertThat(verifier.verify("!!!", "123456")).isFalse();
        assertThat(verifier.verify(null, "123456")).isFalse();
    }

    @Test
    void generatedSecretIs160BitsOfBase32() {
        String secret = verifier.generateSecret();

        assertThat(secret).matches("[A-Z2-7]{32}");
        assertThat(verifier.decodeSecret(secret)).hasSize(20);
        assertThat(verifier.generateSecret()).isNotEqualTo(secret);
    }

    @Test
    void secretsAreNormalisedBeforeVerifying() {
        String code = verifier.generateCode(RFC_SECRET, clock.instant());
        String sloppy = "gezd gnbv gy3t qojq gezd gnbv gy3t qojq";

        assertThat(verifier.generateCode(sloppy, clock.instant())).isEqualTo(code);
        assertThat(verifier.verify(sloppy, code)).isTrue();
        assertThat(verifier.verify(RFC_SECRET + "====", code)).isTrue();
    }

    @Test
    void backupCodesAreGeneratedAlongsideTheirHashes() {
        BackupCodes codes = verifier.generateBackupCodes(10);

        assertThat(codes.plainCodes()).hasSize(10);
        assertThat(codes.hashedCodes()).hasSize(10);
        assertThat(new HashSet<>(codes.plainCodes())).hasSize(10);
        assertThat(codes.plainCodes()).allMatch(code -> code.matches("[A-Z2-9]{5}-[A-Z2-9]{5}"));
        assertThat(codes.hashedCodes()).allMatch(hash -> hash.matches("[0-9a-f]{64}"));
        assertThat(codes.hashedCodes()).doesNotContainAnyElementsOf(codes.plainCodes());
    }

    @Test
    void firstBackupCodeVerifiesAtIndexZero() {
        BackupCodes codes = verifier.generateBackupCodes(10);
        String first = codes.plainCodes().get(0);

        assertThat(verifier.verifyBackupCode(first, codes.hashedCodes())).isEqualTo(OptionalInt.of(0));
    }

    @Test
    void backupCodeInputIsNormalised() {
        BackupCodes codes = verifier.generateBackupCodes(3);
        String third = codes.plainCodes().get(2);
        String sloppy = " " + third.toLowerCase().replace("-", " ") + " ";

        assertThat(verifier.verifyBackupCode(sloppy, codes.hashedCodes())).isEqualTo(OptionalInt.of(2));
    }

    @Test
    void unknownOrEmptyBackupCodeDoesNotMatch() {
        List<String> hashes = verifier.generateBackupCodes(5).hashedCodes();

        assertThat(verifier.verifyBackupCode("ZZZZZ-ZZZZZ", hashes)).isEmpty();
        assertThat(verifier.verifyBackupCode("---", hashes)).isEmpty();
        assertThat(verifier.verifyBackupCode(null, hashes)).isEmpty();
        assertThat(verifier.verifyBackupCode("ABCDE-FGHJK", List.of())).isEmpty();
    }

    @Test
    void defaultBackupCodeSetFollowsConfiguration() {
        SecurityProperties properties = new SecurityProperties();
        properties.getMfa().setBackupCodeCount(4);
        properties.getMfa().setBackupCodeLength(8);
        TotpVerifier configured = new TotpVerifier(clock, properties);

        BackupCodes codes = configured.generateBackupCodes();

        assertThat(codes.plainCodes()).hasSize(4).allMatch(code -> code.matches("[A-Z2-9]{4}-[A-Z2-9]{4}"));
    }
}
