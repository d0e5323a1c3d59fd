package com.revolution.backend.dto;

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
public class MfaDisableRequest {

    @NotBlank
    @ToString.Exclude
    @Schema(accessMode = Schema.AccessMode.WRITE_ONLY)
    private String password;
}
