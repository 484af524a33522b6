package com.hubhrms.onboarding.dto;

import com.hubhrms.onboarding.entity.WorkflowIntegration;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

public record IntegrationResponse(
        UUID id,
        UUID workflowId,
        UUID stepId,
        String integrationType,
        String status,
        Map<String, Object> requestPayload,
        Map<String, Object> responsePayload,
        String errorMessage,
        String externalId,
        int retryCount,
        int maxRetries,
        boolean superseded,
        LocalDateTime lastAttemptAt
) {
    public static IntegrationResponse from(WorkflowIntegration integration) {
        return new IntegrationResponse(
                integration.getId(),
                integration.getWorkflowId(),
                integration.getStepId(),
                integration.getIntegrationType().getValue(),
                integration.getStatus().name(),
                integration.getRequestPayload(),
                integration.getResponsePayload(),
                integration.getErrorMessage(),
                integration.getExternalId(),
                integration.getRetryCount(),
                integration.getMaxRetries(),
                integration.isSuperseded(),
                integration.getLastAttemptAt()
        );
    }
}
