package com.hubhrms.onboarding.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record SkipStepRequest(
        @NotNull UUID userId,
        @NotBlank @Size(max = 500) String reason
) {
}
