package com.hubhrms.onboarding.controller;

import com.hubhrms.common.dto.ApiResponse;
import com.hubhrms.onboarding.dto.ExceptionResponse;
import com.hubhrms.onboarding.dto.InitiateWorkflowRequest;
import com.hubhrms.onboarding.dto.IntegrationResponse;
import com.hubhrms.onboarding.dto.RaiseExceptionRequest;
import com.hubhrms.onboarding.dto.StepResponse;
import com.hubhrms.onboarding.dto.WorkflowResponse;
import com.hubhrms.onboarding.entity.OnboardingWorkflow;
import com.hubhrms.onboarding.entity.WorkflowDocument;
import com.hubhrms.onboarding.entity.WorkflowException;
import com.hubhrms.onboarding.entity.WorkflowStatus;
import com.hubhrms.onboarding.service.OnboardingWorkflowService;
import com.hubhrms.onboarding.service.WorkflowDetails;
import com.hubhrms.onboarding.service.WorkflowExceptionService;
import com.hubhrms.onboarding.service.WorkflowProgress;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/onboarding/workflows")
@RequiredArgsConstructor
public class WorkflowController {

    private final OnboardingWorkflowService workflowService;
    private final WorkflowExceptionService exceptionService;

    /**
     * 온보딩 시작
     */
    @PostMapping
    public ResponseEntity<ApiResponse<WorkflowResponse>> initiateWorkflow(
            @Valid @RequestBody InitiateWorkflowRequest request) {
        OnboardingWorkflow workflow = workflowService.initiateWorkflow(
                request.employeeId(), request.templateName(), request.createdBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(WorkflowResponse.from(workflow)));
    }

    /**
     * 워크플로우 목록 (상태/직원 필터 선택)
     */
    @GetMapping
    public ApiResponse<List<WorkflowResponse>> listWorkflows(
            @RequestParam(required = false) WorkflowStatus status,
            @RequestParam(required = false) UUID employeeId) {
        return ApiResponse.success(workflowService.listWorkflows(status, employeeId).stream()
                .map(WorkflowResponse::from)
                .toList());
    }

    /**
     * 워크플로우 상세 (단계, 예외, 문서, 연동 기록)
     */
    @GetMapping("/{workflowId}")
    public ApiResponse<WorkflowDetailResponse> getWorkflow(@PathVariable UUID workflowId) {
        return ApiResponse.success(WorkflowDetailResponse.from(workflowService.getWorkflow(workflowId)));
    }

    @PostMapping("/{workflowId}/cancel")
    public ApiResponse<WorkflowResponse> cancelWorkflow(@PathVariable UUID workflowId) {
        return ApiResponse.success(WorkflowResponse.from(workflowService.cancelWorkflow(workflowId)));
    }

    @GetMapping("/{workflowId}/progress")
    public ApiResponse<WorkflowProgress> checkProgress(@PathVariable UUID workflowId) {
        return ApiResponse.success(workflowService.checkWorkflowProgress(workflowId));
    }

    /**
     * 수동 단계 진행 (운영자 override)
     */
    @PostMapping("/{workflowId}/advance")
    public ApiResponse<WorkflowResponse> advanceStage(@PathVariable UUID workflowId) {
        return ApiResponse.success(WorkflowResponse.from(workflowService.advanceStage(workflowId)));
    }

    @GetMapping("/{workflowId}/exceptions")
    public ApiResponse<List<ExceptionResponse>> listExceptions(@PathVariable UUID workflowId) {
        return ApiResponse.success(exceptionService.listExceptions(workflowId).stream()
                .map(ExceptionResponse::from)
                .toList());
    }

    @PostMapping("/{workflowId}/exceptions")
    public ResponseEntity<ApiResponse<ExceptionResponse>> raiseException(
            @PathVariable UUID workflowId,
            @Valid @RequestBody RaiseExceptionRequest request) {
        WorkflowException exception = exceptionService.raiseException(workflowId, request.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(ExceptionResponse.from(exception)));
    }

    // 응답 DTO
    public record WorkflowDetailResponse(
            WorkflowResponse workflow,
            List<StepResponse> steps,
            List<ExceptionResponse> exceptions,
            List<DocumentResponse> documents,
            List<IntegrationResponse> integrations
    ) {
        public static WorkflowDetailResponse from(WorkflowDetails details) {
            return new WorkflowDetailResponse(
                    WorkflowResponse.from(details.workflow()),
                    details.steps().stream().map(StepResponse::from).toList(),
                    details.exceptions().stream().map(ExceptionResponse::from).toList(),
                    details.documents().stream().map(DocumentResponse::from).toList(),
                    details.integrations().stream().map(IntegrationResponse::from).toList()
            );
        }
    }

    public record DocumentResponse(
            UUID id,
            UUID stepId,
            String documentName,
            String documentType,
            String storageKey,
            String fileType,
            long fileSize,
            String status,
            Map<String, Object> metadata
    ) {
        public static DocumentResponse from(WorkflowDocument document) {
            return new DocumentResponse(
                    document.getId(),
                    document.getStepId(),
                    document.getDocumentName(),
                    document.getDocumentType(),
                    document.getStorageKey(),
                    document.getFileType(),
                    document.getFileSize(),
                    document.getStatus(),
                    document.getMetadata()
            );
        }
    }
}
