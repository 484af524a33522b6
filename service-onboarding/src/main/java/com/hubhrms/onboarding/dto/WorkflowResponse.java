package com.hubhrms.onboarding.dto;

import com.hubhrms.onboarding.entity.OnboardingWorkflow;

import java.time.LocalDateTime;
import java.util.UUID;

public record WorkflowResponse(
        UUID id,
        UUID employeeId,
        String employeeName,
        String employeeEmail,
        String templateName,
        String status,
        String currentStage,
        int overallProgress,
        LocalDateTime startDate,
        LocalDateTime expectedCompletionDate,
        LocalDateTime actualCompletionDate,
        UUID createdBy
) {
    public static WorkflowResponse from(OnboardingWorkflow workflow) {
        return new WorkflowResponse(
                workflow.getId(),
                workflow.getEmployeeId(),
                workflow.getEmployeeName(),
                workflow.getEmployeeEmail(),
                workflow.getTemplateName(),
                workflow.getStatus().name(),
                workflow.getCurrentStage().getValue(),
                workflow.getOverallProgress(),
                workflow.getStartDate(),
                workflow.getExpectedCompletionDate(),
                workflow.getActualCompletionDate(),
                workflow.getCreatedBy()
        );
    }
}
