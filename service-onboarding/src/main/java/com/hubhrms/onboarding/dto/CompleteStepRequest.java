package com.hubhrms.onboarding.dto;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record CompleteStepRequest(
        @NotNull UUID completedBy
) {
}
