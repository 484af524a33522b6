package com.hubhrms.onboarding.entity;

/**
 * 워크플로우 예외 유형
 */
public enum ExceptionType {
    INTEGRATION_FAILURE,
    SLA_BREACH,
    DATA_MISSING,
    MANUAL_REVIEW,
    OTHER
}
