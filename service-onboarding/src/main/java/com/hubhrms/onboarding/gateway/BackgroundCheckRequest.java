package com.hubhrms.onboarding.gateway;

import java.util.List;
import java.util.UUID;

public record BackgroundCheckRequest(
        String firstName,
        String lastName,
        String email,
        List<String> checkTypes,   // criminal, employment, education
        UUID employeeId
) {
    public BackgroundCheckRequest {
        checkTypes = checkTypes == null ? List.of() : List.copyOf(checkTypes);
    }
}
