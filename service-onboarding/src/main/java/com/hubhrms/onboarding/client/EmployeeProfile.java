package com.hubhrms.onboarding.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

/**
 * 직원 서비스가 돌려주는 직원 정보 중 온보딩에 필요한 부분
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmployeeProfile(
        UUID id,
        String firstName,
        String lastName,
        String email,
        UUID managerId
) {
    public String fullName() {
        return firstName + " " + lastName;
    }
}
