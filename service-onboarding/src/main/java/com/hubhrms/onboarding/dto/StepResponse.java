package com.hubhrms.onboarding.dto;

import com.hubhrms.onboarding.entity.WorkflowStep;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record StepResponse(
        UUID id,
        UUID workflowId,
        int stepOrder,
        String stepName,
        String description,
        String stepType,
        String stage,
        String integrationType,
        Map<String, Object> integrationConfig,
        String status,
        List<UUID> dependencies,
        LocalDateTime dueDate,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        UUID completedBy,
        UUID skippedBy,
        String skipReason
) {
    public static StepResponse from(WorkflowStep step) {
        return new StepResponse(
                step.getId(),
                step.getWorkflowId(),
                step.getStepOrder(),
                step.getStepName(),
                step.getDescription(),
                step.getStepType().name(),
                step.getStage().getValue(),
                step.getIntegrationType() == null ? null : step.getIntegrationType().getValue(),
                step.getIntegrationConfig(),
                step.getStatus().name(),
                List.copyOf(step.getDependencies()),
                step.getDueDate(),
                step.getStartedAt(),
                step.getCompletedAt(),
                step.getCompletedBy(),
                step.getSkippedBy(),
                step.getSkipReason()
        );
    }
}
