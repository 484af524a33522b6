package com.hubhrms.onboarding.entity;

/**
 * 단계 유형
 */
public enum StepType {
    MANUAL,       // 담당자가 직접 처리
    INTEGRATION   // 외부 연동(전자서명, 신원조회, 문서검색) 호출
}
