package com.hubhrms.onboarding.service;

import com.hubhrms.common.exception.BusinessException;
import com.hubhrms.common.exception.ErrorCode;
import com.hubhrms.onboarding.client.EmployeeDirectory;
import com.hubhrms.onboarding.client.EmployeeProfile;
import com.hubhrms.onboarding.config.OnboardingProperties;
import com.hubhrms.onboarding.entity.IntegrationType;
import com.hubhrms.onboarding.entity.OnboardingWorkflow;
import com.hubhrms.onboarding.entity.WorkflowIntegration;
import com.hubhrms.onboarding.entity.WorkflowStep;
import com.hubhrms.onboarding.gateway.BackgroundCheckRequest;
import com.hubhrms.onboarding.gateway.BackgroundCheckResult;
import com.hubhrms.onboarding.gateway.DocSearchRequest;
import com.hubhrms.onboarding.gateway.DocSearchResult;
import com.hubhrms.onboarding.gateway.DocuSignEnvelopeRequest;
import com.hubhrms.onboarding.gateway.DocuSignEnvelopeResult;
import com.hubhrms.onboarding.gateway.FoundDocument;
import com.hubhrms.onboarding.gateway.IntegrationGatewayRegistry;
import com.hubhrms.onboarding.repository.OnboardingWorkflowRepository;
import com.hubhrms.onboarding.repository.WorkflowIntegrationRepository;
import com.hubhrms.onboarding.repository.WorkflowStepRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 외부 연동 트리거
 *
 * <h2>흐름</h2>
 * <pre>
 * 1. 단계/워크플로우(/직원) 조회, 요청 페이로드 구성
 * 2. PENDING 연동 기록 저장 (max_retries 기록)
 * 3. gateway 동기 호출 (CircuitBreaker + TimeLimiter)
 * 4. 성공 → COMPLETED + 응답/externalId 저장 (문서 검색은 문서 레코드 생성)
 * 5. 실패 → FAILED + 오류 메시지, integration_failure(HIGH) 예외 생성 후 호출자에게 오류 반환
 * </pre>
 *
 * 자동 재시도는 하지 않는다. 실패 후 단계 상태는 그대로 두며 운영자가 {@link #retryIntegration(UUID)} 로 다시 시도한다.
 * 외부 호출 동안 DB 트랜잭션을 잡지 않도록 이 클래스에는 @Transactional 을 두지 않는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntegrationTriggerService {

    private final WorkflowStepRepository stepRepository;
    private final OnboardingWorkflowRepository workflowRepository;
    private final WorkflowIntegrationRepository integrationRepository;
    private final EmployeeDirectory employeeDirectory;
    private final IntegrationGatewayRegistry gateways;
    private final IntegrationCallExecutor callExecutor;
    private final IntegrationAuditService auditService;
    private final OnboardingProperties properties;

    /**
     * 전자서명 요청 발송
     *
     * @param documentType 비어 있으면 단계 설정의 document_type 사용
     */
    public WorkflowIntegration triggerDocuSign(UUID stepId, String documentType) {
        WorkflowStep step = findStep(stepId);
        OnboardingWorkflow workflow = findActiveWorkflow(step);
        EmployeeProfile employee = findEmployee(workflow.getEmployeeId());

        String resolvedType = firstNonBlank(documentType, step.configValue("document_type"));
        if (resolvedType == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "document_type 이 필요합니다: stepId=" + stepId);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("document_type", resolvedType);
        payload.put("signer_email", employee.email());
        payload.put("signer_name", employee.fullName());
        payload.put("employee_id", employee.id().toString());

        return dispatch(step, IntegrationType.DOCUSIGN, payload, 0);
    }

    /**
     * 신원조회 요청
     *
     * @param checkTypes 비어 있으면 단계 설정의 check_types, 그것도 없으면 기본값
     */
    public WorkflowIntegration triggerBackgroundCheck(UUID stepId, List<String> checkTypes) {
        WorkflowStep step = findStep(stepId);
        OnboardingWorkflow workflow = findActiveWorkflow(step);
        EmployeeProfile employee = findEmployee(workflow.getEmployeeId());

        List<String> resolvedTypes = checkTypes;
        if (resolvedTypes == null || resolvedTypes.isEmpty()) {
            resolvedTypes = toStringList(step.getIntegrationConfig().get("check_types"));
        }
        if (resolvedTypes.isEmpty()) {
            resolvedTypes = properties.getBackgroundCheck().getDefaultCheckTypes();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("first_name", employee.firstName());
        payload.put("last_name", employee.lastName());
        payload.put("email", employee.email());
        payload.put("check_types", List.copyOf(resolvedTypes));
        payload.put("employee_id", employee.id().toString());

        return dispatch(step, IntegrationType.BACKGROUND_CHECK, payload, 0);
    }

    /**
     * 문서 검색 후 찾은 문서를 단계에 연결
     *
     * @param query 비어 있으면 단계 설정의 query
     */
    public WorkflowIntegration triggerDocSearch(UUID stepId, String query) {
        WorkflowStep step = findStep(stepId);
        findActiveWorkflow(step);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", firstNonBlank(query, step.configValue("query")));
        payload.put("limit", properties.getDocSearch().getLimit());

        return dispatch(step, IntegrationType.DOC_SEARCH, payload, 0);
    }

    /**
     * 운영자 재시도
     * FAILED 이고 아직 재시도되지 않았으며 retryCount < maxRetries 인 기록만 가능.
     * 저장된 요청으로 다시 호출하고 retryCount 를 1 올린 새 기록을 만든다. 이전 기록은 superseded 가 된다.
     */
    public WorkflowIntegration retryIntegration(UUID integrationId) {
        WorkflowIntegration previous = integrationRepository.findById(integrationId)
                .orElseThrow(() -> new BusinessException(ErrorCode.INTEGRATION_NOT_FOUND,
                        "integrationId=" + integrationId));

        WorkflowStep step = findStep(previous.getStepId());
        findActiveWorkflow(step);

        WorkflowIntegration claimed = auditService.claimRetry(integrationId);

        log.info("[Integration] 운영자 재시도: integrationId={}, type={}, attempt={}",
                integrationId, claimed.getIntegrationType().getValue(), claimed.getRetryCount() + 1);
        return dispatch(step, claimed.getIntegrationType(), claimed.getRequestPayload(), claimed.getRetryCount() + 1);
    }

    public List<WorkflowIntegration> listRetryableIntegrations() {
        return integrationRepository.findRetryable();
    }

    // ========================================
    // 공통 호출 흐름
    // ========================================

    private WorkflowIntegration dispatch(WorkflowStep step, IntegrationType type,
                                         Map<String, Object> payload, int retryCount) {
        WorkflowIntegration integration = auditService.open(step, type, payload,
                properties.getIntegration().getMaxRetries(), retryCount);

        AdapterOutcome outcome;
        try {
            outcome = callExecutor.execute(type, () -> callAdapter(type, payload));
        } catch (IntegrationCallException e) {
            auditService.recordFailure(integration, e.getMessage());
            ErrorCode errorCode = e.isTimeout() ? ErrorCode.INTEGRATION_TIMEOUT : ErrorCode.INTEGRATION_FAILED;
            throw new BusinessException(errorCode, describe(step, type, e.getMessage()), e);
        }

        if (!outcome.success()) {
            auditService.recordFailure(integration, outcome.errorMessage());
            throw new BusinessException(ErrorCode.INTEGRATION_FAILED, describe(step, type, outcome.errorMessage()));
        }

        return auditService.recordSuccess(integration, outcome.externalId(), outcome.response(), outcome.documents());
    }

    /**
     * 저장된 페이로드로 gateway 호출 (최초 호출과 재시도가 같은 경로를 탄다)
     */
    private AdapterOutcome callAdapter(IntegrationType type, Map<String, Object> payload) {
        return switch (type) {
            case DOCUSIGN -> {
                DocuSignEnvelopeResult result = gateways.docuSign().sendEnvelope(new DocuSignEnvelopeRequest(
                        asString(payload.get("document_type")),
                        asString(payload.get("signer_email")),
                        asString(payload.get("signer_name")),
                        asUuid(payload.get("employee_id"))));
                if (!result.success()) {
                    yield AdapterOutcome.failed(result.errorMessage());
                }
                Map<String, Object> response = new LinkedHashMap<>();
                response.put("envelope_id", result.envelopeId());
                response.put("status", result.status());
                response.put("sent_at", asString(result.sentAt()));
                response.put("signer_email", result.signerEmail());
                yield AdapterOutcome.succeeded(result.envelopeId(), response, List.of());
            }
            case BACKGROUND_CHECK -> {
                BackgroundCheckResult result = gateways.backgroundCheck().initiateCheck(new BackgroundCheckRequest(
                        asString(payload.get("first_name")),
                        asString(payload.get("last_name")),
                        asString(payload.get("email")),
                        toStringList(payload.get("check_types")),
                        asUuid(payload.get("employee_id"))));
                if (!result.success()) {
                    yield AdapterOutcome.failed(result.errorMessage());
                }
                Map<String, Object> response = new LinkedHashMap<>();
                response.put("check_id", result.checkId());
                response.put("status", result.status());
                response.put("candidate", result.candidate());
                response.put("check_types", result.checkTypes());
                response.put("initiated_at", asString(result.initiatedAt()));
                yield AdapterOutcome.succeeded(result.checkId(), response, List.of());
            }
            case DOC_SEARCH -> {
                Object limit = payload.get("limit");
                DocSearchResult result = gateways.docSearch().searchDocuments(new DocSearchRequest(
                        asString(payload.get("query")),
                        limit instanceof Number number ? number.intValue() : properties.getDocSearch().getLimit()));
                if (!result.success()) {
                    yield AdapterOutcome.failed(result.errorMessage());
                }
                Map<String, Object> response = new LinkedHashMap<>();
                response.put("total_count", result.totalCount());
                response.put("documents", result.documents().stream().map(this::toPayload).toList());
                yield AdapterOutcome.succeeded(null, response, result.documents());
            }
        };
    }

    private Map<String, Object> toPayload(FoundDocument document) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", document.name());
        map.put("document_type", document.documentType());
        map.put("storage_key", document.storageKey());
        map.put("file_type", document.fileType());
        map.put("file_size", document.fileSize());
        map.put("metadata", document.metadata());
        return map;
    }

    private record AdapterOutcome(
            boolean success,
            String externalId,
            Map<String, Object> response,
            List<FoundDocument> documents,
            String errorMessage
    ) {
        static AdapterOutcome succeeded(String externalId, Map<String, Object> response, List<FoundDocument> documents) {
            return new AdapterOutcome(true, externalId, response, documents, null);
        }

        static AdapterOutcome failed(String errorMessage) {
            return new AdapterOutcome(false, null, Map.of(), List.of(), errorMessage);
        }
    }

    // ========================================
    // 조회 헬퍼
    // ========================================

    private WorkflowStep findStep(UUID stepId) {
        return stepRepository.findById(stepId)
                .orElseThrow(() -> new BusinessException(ErrorCode.STEP_NOT_FOUND, "stepId=" + stepId));
    }

    /**
     * 종료된 워크플로우에는 새 연동을 시작하지 않는다 (이미 진행 중인 호출은 그대로 기록된다)
     */
    private OnboardingWorkflow findActiveWorkflow(WorkflowStep step) {
        OnboardingWorkflow workflow = workflowRepository.findById(step.getWorkflowId())
                .orElseThrow(() -> new BusinessException(ErrorCode.WORKFLOW_NOT_FOUND,
                        "workflowId=" + step.getWorkflowId()));
        if (workflow.isTerminal()) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "workflowId=" + workflow.getId() + ", status=" + workflow.getStatus() + ", operation=triggerIntegration");
        }
        return workflow;
    }

    private EmployeeProfile findEmployee(UUID employeeId) {
        return employeeDirectory.findById(employeeId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EMPLOYEE_NOT_FOUND, "employeeId=" + employeeId));
    }

    private static String describe(WorkflowStep step, IntegrationType type, String error) {
        return "stepId=" + step.getId() + ", type=" + type.getValue() + ", error=" + error;
    }

    private static String firstNonBlank(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static UUID asUuid(Object value) {
        return value == null ? null : UUID.fromString(value.toString());
    }

    private static List<String> toStringList(Object value) {
        if (value instanceof Collection<?> collection) {
            List<String> result = new ArrayList<>();
            collection.forEach(item -> result.add(String.valueOf(item)));
            return result;
        }
        return List.of();
    }
}
