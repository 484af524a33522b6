package com.hubhrms.onboarding.dto;

import com.hubhrms.onboarding.entity.ExceptionType;
import com.hubhrms.onboarding.entity.Severity;
import com.hubhrms.onboarding.service.ExceptionDraft;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record RaiseExceptionRequest(
        UUID stepId,
        @NotNull ExceptionType exceptionType,
        @NotNull Severity severity,
        @NotBlank @Size(max = 200) String title,
        @Size(max = 2000) String description,
        UUID assignedTo
) {
    public ExceptionDraft toDraft() {
        return new ExceptionDraft(stepId, exceptionType, severity, title, description, assignedTo);
    }
}
