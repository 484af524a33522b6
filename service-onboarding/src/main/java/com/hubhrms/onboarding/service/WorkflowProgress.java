package com.hubhrms.onboarding.service;

import com.hubhrms.onboarding.entity.OnboardingStage;
import com.hubhrms.onboarding.entity.OnboardingWorkflow;
import com.hubhrms.onboarding.entity.StepStatus;
import com.hubhrms.onboarding.entity.WorkflowStatus;
import com.hubhrms.onboarding.entity.WorkflowStep;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 진행 현황 스냅샷 (요청 시점에 계산, 저장하지 않음)
 *
 * <pre>
 * progressPercentage = completedSteps * 100 / totalSteps   (단계가 없으면 0)
 * expectedPercentage = min(100, daysElapsed * 100 / expectedDays)   (expectedDays <= 0 이면 100)
 * onTrack            = progressPercentage >= expectedPercentage
 * </pre>
 */
public record WorkflowProgress(
        UUID workflowId,
        WorkflowStatus status,
        OnboardingStage currentStage,
        int overallProgress,
        int totalSteps,
        int completedSteps,
        int skippedSteps,
        int inProgressSteps,
        int pendingSteps,
        int blockedSteps,
        int failedSteps,
        int progressPercentage,
        long daysElapsed,
        long expectedDays,
        int expectedPercentage,
        boolean onTrack,
        long openExceptions
) {

    public static WorkflowProgress calculate(OnboardingWorkflow workflow, List<WorkflowStep> steps,
                                             long openExceptions, LocalDateTime now) {
        Map<StepStatus, Integer> counts = new EnumMap<>(StepStatus.class);
        steps.forEach(step -> counts.merge(step.getStatus(), 1, Integer::sum));

        int total = steps.size();
        int completed = counts.getOrDefault(StepStatus.COMPLETED, 0);
        int percentage = total == 0 ? 0 : completed * 100 / total;

        long daysElapsed = Math.max(0, ChronoUnit.DAYS.between(workflow.getStartDate(), now));
        long expectedDays = workflow.getExpectedCompletionDate() == null ? 0
                : ChronoUnit.DAYS.between(workflow.getStartDate(), workflow.getExpectedCompletionDate());
        int expectedPercentage = expectedDays <= 0 ? 100
                : (int) Math.min(100, daysElapsed * 100 / expectedDays);

        return new WorkflowProgress(
                workflow.getId(),
                workflow.getStatus(),
                workflow.getCurrentStage(),
                workflow.getOverallProgress(),
                total,
                completed,
                counts.getOrDefault(StepStatus.SKIPPED, 0),
                counts.getOrDefault(StepStatus.IN_PROGRESS, 0),
                counts.getOrDefault(StepStatus.PENDING, 0),
                counts.getOrDefault(StepStatus.BLOCKED, 0),
                counts.getOrDefault(StepStatus.FAILED, 0),
                percentage,
                daysElapsed,
                expectedDays,
                expectedPercentage,
                percentage >= expectedPercentage,
                openExceptions
        );
    }
}
