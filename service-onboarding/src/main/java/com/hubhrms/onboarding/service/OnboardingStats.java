package com.hubhrms.onboarding.service;

/**
 * 대시보드 통계
 */
public record OnboardingStats(
        int templatesCount,
        long activeWorkflows,
        int completedThisMonth,
        long averageCompletionDays,
        long openExceptions
) {
}
