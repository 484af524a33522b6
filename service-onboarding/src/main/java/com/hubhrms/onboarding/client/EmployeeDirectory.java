package com.hubhrms.onboarding.client;

import java.util.Optional;
import java.util.UUID;

/**
 * 직원 조회 협력자
 */
public interface EmployeeDirectory {

    /**
     * @return 직원이 없으면 empty. 조회 자체가 실패하면 예외.
     */
    Optional<EmployeeProfile> findById(UUID employeeId);
}
