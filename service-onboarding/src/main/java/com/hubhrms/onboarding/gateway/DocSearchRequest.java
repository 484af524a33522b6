package com.hubhrms.onboarding.gateway;

public record DocSearchRequest(
        String query,
        int limit
) {
}
