package com.revolution.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Returned once at enrollment. The secret and plain backup codes are not retrievable afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MfaSetupResponse {

    private String secret;

    @JsonProperty("otpauth_uri")
    private String otpauthUri;

    @JsonProperty("qr_code")
    private String qrCode;

    @JsonProperty("backup_codes")
    private List<String> backupCodes;
}
