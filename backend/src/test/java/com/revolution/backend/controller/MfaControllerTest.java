package com.revolution.backend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.revolution.backend.model.User;
import com.revolution.backend.repository.SecurityEventRepository;
import com.revolution.backend.repository.UserRepository;
import com.revolution.backend.security.CredentialHasher;
import com.revolution.backend.security.InMemoryRateLimitStore;
import com.revolution.backend.security.TokenCodec;
import com.revolution.backend.security.TotpVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class MfaControllerTest {

    private static final String PASSWORD = "Str0ng-Passw0rd!";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private SecurityEventRepository securityEventRepository;

    @Autowired
    private CredentialHasher credentialHasher;

    @Autowired
    private TotpVerifier totpVerifier;

    @Autowired
    private TokenCodec tokenCodec;

    @Autowired
    private InMemoryRateLimitStore rateLimitStore;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private User user;
    private String token;

    @BeforeEach
    void setup() {
        securityEventRepository.deleteAll();
        userRepository.deleteAll();
        rateLimitStore.removeIf(entry -> true);
        user = userRepository.save(User.builder()
                .email("mfa@example.com")
                .name("Mfa User")
                .passwordHash(credentialHasher.hash(PASSWORD))
                .role("USER")
                .build());
        token = tokenCodec.issueAccessToken(String.valueOf(user.getId()), user.getEmail(), user.getRole(),
                user.getTokenVersion());
    }

    @Test
    void setupReturnsSecretUriQrAndBackupCodesWithoutEnabling() throws Exception {
        JsonNode setup = startSetup();

        assertThat(setup.get("secret").asText()).matches("[A-Z2-7]{32}");
        assertThat(setup.get("otpauth_uri").asText())
                .startsWith("otpauth://totp/")
                .contains("secret=" + setup.get("secret").asText());
        assertThat(setup.get("qr_code").asText()).startsWith("data:image/png;base64,");
        assertThat(setup.get("backup_codes")).hasSize(10);

        User stored = userRepository.findById(user.getId()).orElseThrow();
        assertThat(stored.isMfaEnabled()).isFalse();
        assertThat(stored.getMfaSecret()).isEqualTo(setup.get("secret").asText());
        assertThat(stored.getMfaBackupCodes()).hasSize(10);
    }

    @Test
    void secretIsEncryptedAtRest() throws Exception {
        JsonNode setup = startSetup();

        String column = jdbcTemplate.queryForObject(
                "select mfa_secret from users where id = ?", String.class, user.getId());
        assertThat(column).startsWith("enc:v1:");
        assertThat(column).doesNotContain(setup.get("secret").asText());
    }

    @Test
    void confirmRejectsWrongCodeThenEnables() throws Exception {
        String secret = startSetup().get("secret").asText();

        mockMvc.perform(post("/api/auth/mfa/confirm")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("code", wrongCode(secret)))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid verification code."));

        confirm(secret);

        User stored = userRepository.findById(user.getId()).orElseThrow();
        assertThat(stored.isMfaEnabled()).isTrue();
        assertThat(stored.getMfaEnabledAt()).isNotNull();

        mockMvc.perform(post("/api/auth/mfa/setup").header("Authorization", "Bearer " + token))
                .andExpect(status().isConflict());
    }

    @Test
    void confirmWithoutSetupIsRejected() throws Exception {
        mockMvc.perform(post("/api/auth/mfa/confirm")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("code", "123456"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Two-factor setup has not been started."));
    }

    @Test
    void confirmValidatesCodeShape() throws Exception {
        mockMvc.perform(post("/api/auth/mfa/confirm")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("code", "12ab56"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"));
    }

    @Test
    void disableRequiresPassword() throws Exception {
        confirm(startSetup().get("secret").asText());

        mockMvc.perform(post("/api/auth/mfa/disable")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("password", "Wr0ng-Passw0rd!"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Password is incorrect."));

        mockMvc.perform(post("/api/auth/mfa/disable")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("password", PASSWORD))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Two-factor authentication disabled"));

        User stored = userRepository.findById(user.getId()).orElseThrow();
        assertThat(stored.isMfaEnabled()).isFalse();
        assertThat(stored.getMfaSecret()).isNull();
        assertThat(stored.getMfaBackupCodes()).isEmpty();
    }

    @Test
    void regeneratingBackupCodesInvalidatesPreviousSet() throws Exception {
        JsonNode setup = startSetup();
        String secret = setup.get("secret").asText();
        String oldCode = setup.get("backup_codes").get(0).asText();
        confirm(secret);

        MvcResult result = mockMvc.perform(post("/api/auth/mfa/backup-codes")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("code", totpVerifier.generateCode(secret, Instant.now())))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backup_codes.length()").value(10))
                .andReturn();
        String newCode = objectMapper.readTree(result.getResponse().getContentAsString())
                .get("backup_codes").get(0).asText();

        User stored = userRepository.findById(user.getId()).orElseThrow();
        assertThat(totpVerifier.verifyBackupCode(oldCode, stored.getMfaBackupCodes())).isEmpty();
        assertThat(totpVerifier.verifyBackupCode(newCode, stored.getMfaBackupCodes())).hasValue(0);
    }

    @Test
    void mfaRoutesRequireAuthentication() throws Exception {
        mockMvc.perform(post("/api/auth/mfa/setup"))
                .andExpect(status().isUnauthorized());
    }

    private JsonNode startSetup() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/auth/mfa/setup").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private void confirm(String secret) throws Exception {
        mockMvc.perform(post("/api/auth/mfa/confirm")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("code", totpVerifier.generateCode(secret, Instant.now())))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Two-factor authentication enabled"));
    }

    private String wrongCode(String secret) {
        Instant now = Instant.now();
        String candidate = "000000";
        for (int offset = -1; offset <= 1; offset++) {
            if (candidate.equals(totpVerifier.generateCode(secret, now.plusSeconds(30L * offset)))) {
                candidate = "111111";
            }
        }
        return candidate;
    }

    private String json(Map<String, String> body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }
}
