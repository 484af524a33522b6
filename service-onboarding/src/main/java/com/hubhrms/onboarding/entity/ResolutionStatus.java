package com.hubhrms.onboarding.entity;

/**
 * 예외 처리 상태
 */
public enum ResolutionStatus {
    OPEN,         // 생성 시 초기값
    IN_PROGRESS,  // 담당자 확인 중
    RESOLVED      // 해결 (이후 변경 불가)
}
