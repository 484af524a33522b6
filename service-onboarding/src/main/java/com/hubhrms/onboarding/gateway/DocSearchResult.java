package com.hubhrms.onboarding.gateway;

import java.util.List;

/**
 * 문서 검색 결과
 * totalCount 는 limit 적용 전 전체 매칭 수
 */
public record DocSearchResult(
        boolean success,
        int totalCount,
        List<FoundDocument> documents,
        String errorMessage
) {
    public static DocSearchResult found(int totalCount, List<FoundDocument> documents) {
        return new DocSearchResult(true, totalCount, List.copyOf(documents), null);
    }

    public static DocSearchResult failure(String errorMessage) {
        return new DocSearchResult(false, 0, List.of(), errorMessage);
    }
}
