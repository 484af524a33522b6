package com.hubhrms.onboarding.service;

import com.hubhrms.onboarding.entity.OnboardingWorkflow;
import com.hubhrms.onboarding.entity.WorkflowDocument;
import com.hubhrms.onboarding.entity.WorkflowException;
import com.hubhrms.onboarding.entity.WorkflowIntegration;
import com.hubhrms.onboarding.entity.WorkflowStep;

import java.util.List;

/**
 * 워크플로우 상세 (단계, 예외, 문서, 연동 기록 포함)
 */
public record WorkflowDetails(
        OnboardingWorkflow workflow,
        List<WorkflowStep> steps,
        List<WorkflowException> exceptions,
        List<WorkflowDocument> documents,
        List<WorkflowIntegration> integrations
) {
}
