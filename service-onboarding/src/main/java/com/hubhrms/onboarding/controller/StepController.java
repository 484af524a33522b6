package com.hubhrms.onboarding.controller;

import com.hubhrms.common.dto.ApiResponse;
import com.hubhrms.common.idempotency.Idempotent;
import com.hubhrms.onboarding.dto.CompleteStepRequest;
import com.hubhrms.onboarding.dto.IntegrationResponse;
import com.hubhrms.onboarding.dto.IntegrationTriggerRequest;
import com.hubhrms.onboarding.dto.SkipStepRequest;
import com.hubhrms.onboarding.dto.StepResponse;
import com.hubhrms.onboarding.service.IntegrationTriggerService;
import com.hubhrms.onboarding.service.OnboardingWorkflowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/onboarding/steps")
@RequiredArgsConstructor
public class StepController {

    private final OnboardingWorkflowService workflowService;
    private final IntegrationTriggerService triggerService;

    /**
     * 단계 시작 (선행 단계 미완료 시 409 DEPENDENCY_NOT_MET)
     */
    @PostMapping("/{stepId}/start")
    public ApiResponse<StepResponse> startStep(@PathVariable UUID stepId) {
        return ApiResponse.success(StepResponse.from(workflowService.startStep(stepId)));
    }

    @PostMapping("/{stepId}/complete")
    public ApiResponse<StepResponse> completeStep(@PathVariable UUID stepId,
                                                  @Valid @RequestBody CompleteStepRequest request) {
        return ApiResponse.success(StepResponse.from(workflowService.completeStep(stepId, request.completedBy())));
    }

    @PostMapping("/{stepId}/skip")
    public ApiResponse<StepResponse> skipStep(@PathVariable UUID stepId,
                                              @Valid @RequestBody SkipStepRequest request) {
        return ApiResponse.success(StepResponse.from(
                workflowService.skipStep(stepId, request.userId(), request.reason())));
    }

    // ========================================
    // 외부 연동 트리거
    // 같은 Idempotency Key 로 다시 보내면 외부 호출 없이 이전 응답을 돌려준다
    // ========================================

    @PostMapping("/{stepId}/integrations/docusign")
    @Idempotent(prefix = "onboarding-docusign")
    public ResponseEntity<ApiResponse<IntegrationResponse>> triggerDocuSign(
            @PathVariable UUID stepId,
            @RequestBody(required = false) IntegrationTriggerRequest request) {
        IntegrationTriggerRequest body = request != null ? request : IntegrationTriggerRequest.empty();
        return ResponseEntity.ok(ApiResponse.success(IntegrationResponse.from(
                triggerService.triggerDocuSign(stepId, body.documentType()))));
    }

    @PostMapping("/{stepId}/integrations/background-check")
    @Idempotent(prefix = "onboarding-background-check")
    public ResponseEntity<ApiResponse<IntegrationResponse>> triggerBackgroundCheck(
            @PathVariable UUID stepId,
            @RequestBody(required = false) IntegrationTriggerRequest request) {
        IntegrationTriggerRequest body = request != null ? request : IntegrationTriggerRequest.empty();
        return ResponseEntity.ok(ApiResponse.success(IntegrationResponse.from(
                triggerService.triggerBackgroundCheck(stepId, body.checkTypes()))));
    }

    @PostMapping("/{stepId}/integrations/doc-search")
    @Idempotent(prefix = "onboarding-doc-search")
    public ResponseEntity<ApiResponse<IntegrationResponse>> triggerDocSearch(
            @PathVariable UUID stepId,
            @RequestBody(required = false) IntegrationTriggerRequest request) {
        IntegrationTriggerRequest body = request != null ? request : IntegrationTriggerRequest.empty();
        return ResponseEntity.ok(ApiResponse.success(IntegrationResponse.from(
                triggerService.triggerDocSearch(stepId, body.query()))));
    }
}
