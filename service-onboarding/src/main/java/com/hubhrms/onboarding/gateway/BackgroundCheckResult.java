package com.hubhrms.onboarding.gateway;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 신원조회 접수 결과
 */
public record BackgroundCheckResult(
        boolean success,
        String checkId,
        String status,
        String candidate,
        List<String> checkTypes,
        LocalDateTime initiatedAt,
        String errorMessage
) {
    public static BackgroundCheckResult initiated(String checkId, String candidate,
                                                  List<String> checkTypes, LocalDateTime initiatedAt) {
        return new BackgroundCheckResult(true, checkId, "in-progress", candidate, checkTypes, initiatedAt, null);
    }

    public static BackgroundCheckResult failure(String errorMessage) {
        return new BackgroundCheckResult(false, null, null, null, List.of(), null, errorMessage);
    }
}
