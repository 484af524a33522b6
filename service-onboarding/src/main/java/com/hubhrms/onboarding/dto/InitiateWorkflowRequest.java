package com.hubhrms.onboarding.dto;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record InitiateWorkflowRequest(
        @NotNull UUID employeeId,
        String templateName,
        @NotNull UUID createdBy
) {
    public InitiateWorkflowRequest {
        if (templateName == null || templateName.isBlank()) {
            templateName = "generic";
        }
    }
}
