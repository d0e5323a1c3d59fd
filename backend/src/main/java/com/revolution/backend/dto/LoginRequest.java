package com.revolution.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank
    @Email
    @Size(max = 255)
    private String email;

    @NotBlank
    @Size(max = 1024)
    @ToString.Exclude
    @Schema(accessMode = Schema.AccessMode.WRITE_ONLY)
    private String password;

    @ToString.Exclude
    @Schema(description = "6-digit TOTP code when MFA is enabled", accessMode = Schema.AccessMode.WRITE_ONLY)
    private String code;

    @JsonProperty("backup_code")
    @ToString.Exclude
    @Schema(description = "Single-use backup code, instead of code", accessMode = Schema.AccessMode.WRITE_ONLY)
    private String backupCode;
}
