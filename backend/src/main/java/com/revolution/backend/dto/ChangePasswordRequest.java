package com.revolution.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangePasswordRequest {

    @NotBlank
    @JsonProperty("current_password")
    @ToString.Exclude
    @Schema(accessMode = Schema.AccessMode.WRITE_ONLY)
    private String currentPassword;

    @NotBlank
    @JsonProperty("new_password")
    @ToString.Exclude
    @Schema(accessMode = Schema.AccessMode.WRITE_ONLY)
    private String newPassword;
}
