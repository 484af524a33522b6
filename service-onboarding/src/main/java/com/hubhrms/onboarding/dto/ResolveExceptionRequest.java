package com.hubhrms.onboarding.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record ResolveExceptionRequest(
        @NotNull UUID resolvedBy,
        @Size(max = 2000) String resolutionNotes
) {
}
