package com.revolution.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfileDTO {
    private Long id;
    private String email;
    private String name;
    private String role;

    @JsonProperty("mfa_enabled")
    private boolean mfaEnabled;

    @JsonProperty("last_login_at")
    private Instant lastLoginAt;
}
