package com.revolution.backend.security;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecretEncryptionServiceTest {

    private static final String KEY = "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=";

    @Test
    void encryptsWithRandomIvAndDecrypts() {
        SecretEncryptionService service = service(new MockEnvironment().withProperty("security.token-encryption-key", KEY));

        String first = service.encrypt("JBSWY3DPEHPK3PXP");
        String second = service.encrypt("JBSWY3DPEHPK3PXP");

        assertThat(first).startsWith("enc:v1:").doesNotContain("JBSWY3DPEHPK3PXP");
        assertThat(first).isNotEqualTo(second);
        assertThat(service.decrypt(first)).isEqualTo("JBSWY3DPEHPK3PXP");
        assertThat(service.encrypt(first)).isEqualTo(first);
    }

    @Test
    void environmentVariableTakesPrecedence() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("SECURITY_TOKEN_ENCRYPTION_KEY", KEY)
                .withProperty("security.token-encryption-key", "not-base64!");

        assertThat(service(environment).isEnabled()).isTrue();
    }

    @Test
    void withoutKeyValuesPassThroughOutsideProduction() {
        SecretEncryptionService service = service(new MockEnvironment());

        assertThat(service.isEnabled()).isFalse();
        assertThat(service.encrypt("JBSWY3DPEHPK3PXP")).isEqualTo("JBSWY3DPEHPK3PXP");
        assertThatThrownBy(() -> service.decrypt("enc:v1:AAAA")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void productionRefusesToStartWithoutKey() {
        MockEnvironment environment = new MockEnvironment();
        environment.setActiveProfiles("prod");

        assertThatThrownBy(() -> service(environment)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void wrongLengthKeyIsRejected() {
        MockEnvironment environment = new MockEnvironment().withProperty("security.token-encryption-key", "c2hvcnQ=");

        assertThatThrownBy(() -> service(environment)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void tamperedCiphertextFailsLoudly() {
        SecretEncryptionService service = service(new MockEnvironment().withProperty("security.token-encryption-key", KEY));
        String encrypted = service.encrypt("JBSWY3DPEHPK3PXP");
        char last = encrypted.charAt(encrypted.length() - 3);
        String tampered = encrypted.substring(0, encrypted.length() - 3) + (last == 'A' ? 'B' : 'A')
                + encrypted.substring(encrypted.length() - 2);

        assertThatThrownBy(() -> service.decrypt(tampered)).isInstanceOf(IllegalStateException.class);
    }

    private static SecretEncryptionService service(MockEnvironment environment) {
        SecretEncryptionService service = new SecretEncryptionService(environment);
        service.init();
        return service;
    }
}
