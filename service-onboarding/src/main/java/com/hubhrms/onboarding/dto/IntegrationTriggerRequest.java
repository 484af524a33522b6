package com.hubhrms.onboarding.dto;

import java.util.List;

/**
 * 연동 트리거 요청 (모든 필드 선택, 비어 있으면 단계 설정값 사용)
 *
 * @param documentType 전자서명 문서 유형
 * @param checkTypes   신원조회 항목
 * @param query        문서 검색어
 */
public record IntegrationTriggerRequest(
        String documentType,
        List<String> checkTypes,
        String query
) {
    public static IntegrationTriggerRequest empty() {
        return new IntegrationTriggerRequest(null, null, null);
    }
}
