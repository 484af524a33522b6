package com.hubhrms.onboarding.service;

import com.hubhrms.onboarding.entity.ExceptionType;
import com.hubhrms.onboarding.entity.Severity;

import java.util.UUID;

/**
 * 새 워크플로우 예외 내용 (stepId 가 없으면 워크플로우 단위)
 */
public record ExceptionDraft(
        UUID stepId,
        ExceptionType exceptionType,
        Severity severity,
        String title,
        String description,
        UUID assignedTo
) {
    public static ExceptionDraft integrationFailure(UUID stepId, String integrationType, String error) {
        return new ExceptionDraft(stepId, ExceptionType.INTEGRATION_FAILURE, Severity.HIGH,
                integrationType + " integration failed", error, null);
    }
}
