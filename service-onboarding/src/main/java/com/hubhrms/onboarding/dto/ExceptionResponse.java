package com.hubhrms.onboarding.dto;

import com.hubhrms.onboarding.entity.WorkflowException;

import java.time.LocalDateTime;
import java.util.UUID;

public record ExceptionResponse(
        UUID id,
        UUID workflowId,
        UUID stepId,
        String exceptionType,
        String severity,
        String title,
        String description,
        String resolutionStatus,
        UUID assignedTo,
        UUID resolvedBy,
        String resolutionNotes,
        LocalDateTime resolvedAt,
        LocalDateTime createdAt
) {
    public static ExceptionResponse from(WorkflowException exception) {
        return new ExceptionResponse(
                exception.getId(),
                exception.getWorkflowId(),
                exception.getStepId(),
                exception.getExceptionType().name(),
                exception.getSeverity().name(),
                exception.getTitle(),
                exception.getDescription(),
                exception.getResolutionStatus().name(),
                exception.getAssignedTo(),
                exception.getResolvedBy(),
                exception.getResolutionNotes(),
                exception.getResolvedAt(),
                exception.getCreatedAt()
        );
    }
}
