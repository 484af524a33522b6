package com.hubhrms.onboarding.controller;

import com.hubhrms.common.exception.BusinessException;
import com.hubhrms.common.exception.ErrorCode;
import com.hubhrms.onboarding.entity.IntegrationType;
import com.hubhrms.onboarding.entity.OnboardingStage;
import com.hubhrms.onboarding.entity.OnboardingWorkflow;
import com.hubhrms.onboarding.entity.StepType;
import com.hubhrms.onboarding.entity.WorkflowIntegration;
import com.hubhrms.onboarding.entity.WorkflowStep;
import com.hubhrms.onboarding.service.IntegrationTriggerService;
import com.hubhrms.onboarding.service.OnboardingWorkflowService;
import com.hubhrms.onboarding.service.WorkflowExceptionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {WorkflowController.class, StepController.class})
class OnboardingApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OnboardingWorkflowService workflowService;

    @MockBean
    private WorkflowExceptionService exceptionService;

    @MockBean
    private IntegrationTriggerService triggerService;

    @Test
    @DisplayName("온보딩 시작: 템플릿 이름이 없으면 generic 으로 요청하고 201 을 돌려준다")
    void initiate_created() throws Exception {
        UUID employeeId = UUID.randomUUID();
        UUID createdBy = UUID.randomUUID();
        OnboardingWorkflow workflow = OnboardingWorkflow.builder()
                .employeeId(employeeId)
                .employeeName("Jordan Lee")
                .employeeEmail("jordan.lee@example.com")
                .templateName("generic")
                .createdBy(createdBy)
                .startDate(LocalDateTime.of(2024, 3, 4, 9, 0))
                .build();
        when(workflowService.initiateWorkflow(employeeId, "generic", createdBy)).thenReturn(workflow);

        mockMvc.perform(post("/api/onboarding/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeId\":\"" + employeeId + "\",\"createdBy\":\"" + createdBy + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.status").value("IN_PROGRESS"))
                .andExpect(jsonPath("$.data.currentStage").value("pre-boarding"))
                .andExpect(jsonPath("$.data.overallProgress").value(0));
    }

    @Test
    @DisplayName("employeeId 가 없으면 400 이고 서비스를 호출하지 않는다")
    void initiate_missingEmployee_badRequest() throws Exception {
        mockMvc.perform(post("/api/onboarding/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"createdBy\":\"" + UUID.randomUUID() + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorInfo.code").value("COMMON_001"));

        verify(workflowService, never()).initiateWorkflow(any(), any(), any());
    }

    @Test
    @DisplayName("선행 단계 미완료로 시작할 수 없으면 409 DEPENDENCY_NOT_MET")
    void startStep_dependencyNotMet() throws Exception {
        UUID stepId = UUID.randomUUID();
        when(workflowService.startStep(stepId))
                .thenThrow(new BusinessException(ErrorCode.DEPENDENCY_NOT_MET, "stepId=" + stepId));

        mockMvc.perform(post("/api/onboarding/steps/{stepId}/start", stepId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorInfo.code").value("ONBOARDING_101"));
    }

    @Test
    @DisplayName("건너뜀 사유가 비어 있으면 400")
    void skipStep_blankReason() throws Exception {
        mockMvc.perform(post("/api/onboarding/steps/{stepId}/skip", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"" + UUID.randomUUID() + "\",\"reason\":\"\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("본문 없이 전자서명을 트리거하면 단계 설정값을 쓰도록 document_type 없이 호출한다")
    void triggerDocuSign_withoutBody() throws Exception {
        WorkflowStep step = WorkflowStep.builder()
                .workflowId(UUID.randomUUID())
                .stepOrder(1)
                .stepName("Send Offer Letter")
                .stepType(StepType.INTEGRATION)
                .stage(OnboardingStage.PRE_BOARDING)
                .integrationType(IntegrationType.DOCUSIGN)
                .build();
        WorkflowIntegration integration = WorkflowIntegration.builder()
                .workflowId(step.getWorkflowId())
                .stepId(step.getId())
                .integrationType(IntegrationType.DOCUSIGN)
                .requestPayload(Map.of("document_type", "offer-letter"))
                .build();
        integration.markCompleted("mock-env-1", Map.of("status", "sent"));
        when(triggerService.triggerDocuSign(eq(step.getId()), isNull())).thenReturn(integration);

        mockMvc.perform(post("/api/onboarding/steps/{stepId}/integrations/docusign", step.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.integrationType").value("docusign"))
                .andExpect(jsonPath("$.data.status").value("COMPLETED"))
                .andExpect(jsonPath("$.data.externalId").value("mock-env-1"));
    }

    @Test
    @DisplayName("외부 연동 실패는 502 로 전달된다")
    void triggerBackgroundCheck_failure() throws Exception {
        UUID stepId = UUID.randomUUID();
        when(triggerService.triggerBackgroundCheck(eq(stepId), any()))
                .thenThrow(new BusinessException(ErrorCode.INTEGRATION_FAILED, "error=service unavailable"));

        mockMvc.perform(post("/api/onboarding/steps/{stepId}/integrations/background-check", stepId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"checkTypes\":[\"criminal\"]}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errorInfo.detail").value("error=service unavailable"));
    }
}
