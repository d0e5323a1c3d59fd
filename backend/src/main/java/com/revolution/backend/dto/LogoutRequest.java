package com.revolution.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogoutRequest {

    @JsonProperty("refresh_token")
    @ToString.Exclude
    @Schema(description = "Also revoke this refresh token", accessMode = Schema.AccessMode.WRITE_ONLY)
    private String refreshToken;
}
