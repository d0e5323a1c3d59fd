package com.revolution.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MfaCodeRequest {

    @NotBlank
    @Pattern(regexp = "\\d{6}", message = "must be a 6-digit code")
    @ToString.Exclude
    private String code;
}
