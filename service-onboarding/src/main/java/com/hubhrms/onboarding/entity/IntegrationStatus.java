package com.hubhrms.onboarding.entity;

/**
 * 연동 기록 상태
 */
public enum IntegrationStatus {
    PENDING,      // 기록 생성, 호출 전
    IN_PROGRESS,  // 호출 중
    COMPLETED,    // 성공 (응답 저장됨)
    FAILED        // 실패 (오류 메시지 + 예외 생성됨)
}
