package com.hubhrms.onboarding.entity;

/**
 * 온보딩 워크플로우 상태
 */
public enum WorkflowStatus {
    NOT_STARTED,  // 생성 전 (InitiateWorkflow 는 곧바로 IN_PROGRESS 로 만든다)
    IN_PROGRESS,  // 진행 중
    COMPLETED,    // 완료 (terminal)
    CANCELLED;    // 취소 (terminal)

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
