package com.hubhrms.onboarding.entity;

/**
 * 단계 상태
 */
public enum StepStatus {
    PENDING,      // 시작 가능 대기
    BLOCKED,      // 이후 단계 또는 선행 단계 대기 (생성 시 초기값)
    IN_PROGRESS,  // 진행 중
    COMPLETED,    // 완료
    SKIPPED,      // 건너뜀 (의존성/단계 완료 판단에서는 완료와 동일)
    FAILED;       // 실패

    /**
     * 의존성 및 단계 완료 판단에서 "끝난" 상태인지
     */
    public boolean isDone() {
        return this == COMPLETED || this == SKIPPED;
    }
}
