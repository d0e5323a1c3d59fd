package com.revolution.backend.security;

import com.revolution.backend.config.SecurityProperties;
import com.revolution.backend.exception.UnknownHashFormatException;
import com.revolution.backend.exception.WeakPasswordException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCrypt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialHasherTest {

    private CredentialHasher hasher;

    @BeforeEach
    void setUp() {
        hasher = new CredentialHasher(lowCost(1));
    }

    @Test
    void hashVerifiesAndUsesFreshSalt() {
        String first = hasher.hash("Correct-Horse-9");
        String second = hasher.hash("Correct-Horse-9");

        assertThat(first).startsWith("$argon2id$");
        assertThat(first).isNotEqualTo(second);
        assertThat(hasher.verify("Correct-Horse-9", first)).isTrue();
        assertThat(hasher.verify("Correct-Horse-9", second)).isTrue();
        assertThat(hasher.verify("correct-horse-9", first)).isFalse();
        assertThat(hasher.verify(null, first)).isFalse();
    }

    @Test
    void boundaryLengthPasswordsRoundTrip() {
        String single = "x";
        String longest = "aB3$".repeat(32);

        assertThat(hasher.verify(single, hasher.hash(single))).isTrue();
        assertThat(hasher.verify(longest, hasher.hash(longest))).isTrue();
        assertThat(hasher.verify(longest.substring(1), hasher.hash(longest))).isFalse();
    }

    @Test
    void legacyBcryptPrefixesAreNormalised() {
        String bcrypt = BCrypt.hashpw("legacy-Pass1", BCrypt.gensalt(4));
        String php = "$2y$" + bcrypt.substring(4);
        String openbsd = "$2b$" + bcrypt.substring(4);

        assertThat(hasher.verify("legacy-Pass1", bcrypt)).isTrue();
        assertThat(hasher.verify("legacy-Pass1", php)).isTrue();
        assertThat(hasher.verify("legacy-Pass1", openbsd)).isTrue();
        assertThat(hasher.verify("wrong-Pass1", php)).isFalse();
    }

    @Test
    void unknownFormatIsAHardFailure() {
        assertThatThrownBy(() -> hasher.verify("pw", "5f4dcc3b5aa765d61d8327deb882cf99"))
                .isInstanceOf(UnknownHashFormatException.class);
        assertThatThrownBy(() -> hasher.verify("pw", "$1$salt$hash"))
                .isInstanceOf(UnknownHashFormatException.class);
        assertThatThrownBy(() -> hasher.verify("pw", null))
                .isInstanceOf(UnknownHashFormatException.class);
    }

    @Test
    void corruptLegacyHashIsAMismatch() {
        assertThat(hasher.verify("pw", "$2y$04$short")).isFalse();
    }

    @Test
    void legacyAndWeakerHashesNeedRehash() {
        CredentialHasher stronger = new CredentialHasher(lowCost(2));
        String weak = hasher.hash("Correct-Horse-9");

        assertThat(hasher.needsRehash(BCrypt.hashpw("pw", BCrypt.gensalt(4)))).isTrue();
        assertThat(hasher.needsRehash(weak)).isFalse();
        assertThat(stronger.needsRehash(weak)).isTrue();
    }

    @Test
    void dummyHashRunsWithoutError() {
        assertThatCode(hasher::hashDummy).doesNotThrowAnyException();
    }

    @Test
    void strengthPolicyRejectsShortLongAndSingleClassPasswords() {
        assertThatThrownBy(() -> hasher.validateStrength("Ab1$567")).isInstanceOf(WeakPasswordException.class);
        assertThatThrownBy(() -> hasher.validateStrength("a".repeat(129))).isInstanceOf(WeakPasswordException.class);
        assertThatThrownBy(() -> hasher.validateStrength("alllowercaseletters")).isInstanceOf(WeakPasswordException.class);
        assertThatThrownBy(() -> hasher.validateStrength("lowercase123")).isInstanceOf(WeakPasswordException.class);
        assertThatThrownBy(() -> hasher.validateStrength(null)).isInstanceOf(WeakPasswordException.class);
    }

    @Test
    void strengthPolicyAcceptsMixedPasswords() {
        assertThatCode(() -> hasher.validateStrength("Abcdefg1")).doesNotThrowAnyException();
        assertThatCode(() -> hasher.validateStrength("lower-case-9")).doesNotThrowAnyException();
    }

    private static SecurityProperties lowCost(int iterations) {
        SecurityProperties properties = new SecurityProperties();
        properties.getPassword().setMemoryKib(1024);
        properties.getPassword().setIterations(iterations);
        properties.getPassword().setParallelism(1);
        return properties;
    }
}
