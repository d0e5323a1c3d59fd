package com.revolution.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MfaRequiredResponse {

    @JsonProperty("mfa_required")
    @Builder.Default
    private boolean mfaRequired = true;

    private String message;
}
