package com.hubhrms.onboarding.service;

import com.hubhrms.common.exception.BusinessException;
import com.hubhrms.common.exception.ErrorCode;
import com.hubhrms.onboarding.entity.IntegrationStatus;
import com.hubhrms.onboarding.entity.IntegrationType;
import com.hubhrms.onboarding.entity.WorkflowDocument;
import com.hubhrms.onboarding.entity.WorkflowIntegration;
import com.hubhrms.onboarding.entity.WorkflowStep;
import com.hubhrms.onboarding.gateway.FoundDocument;
import com.hubhrms.onboarding.repository.WorkflowDocumentRepository;
import com.hubhrms.onboarding.repository.WorkflowIntegrationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 연동 기록 쓰기
 *
 * 외부 호출은 트랜잭션 밖에서 하고, 기록 쓰기만 각각 짧은 트랜잭션으로 커밋한다.
 * 실패 기록과 예외 생성은 한 트랜잭션이라 "실패 기록에는 항상 대응하는 예외가 있다".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntegrationAuditService {

    private final WorkflowIntegrationRepository integrationRepository;
    private final WorkflowDocumentRepository documentRepository;
    private final WorkflowExceptionService exceptionService;
    private final Clock clock;

    /**
     * 호출 전 PENDING 기록 생성
     */
    @Transactional
    public WorkflowIntegration open(WorkflowStep step, IntegrationType type,
                                    Map<String, Object> requestPayload, int maxRetries, int retryCount) {
        WorkflowIntegration integration = integrationRepository.save(WorkflowIntegration.builder()
                .workflowId(step.getWorkflowId())
                .stepId(step.getId())
                .integrationType(type)
                .requestPayload(requestPayload)
                .maxRetries(maxRetries)
                .retryCount(retryCount)
                .lastAttemptAt(LocalDateTime.now(clock))
                .build());

        log.info("[Integration] 기록 생성: integrationId={}, stepId={}, type={}, retryCount={}",
                integration.getId(), step.getId(), type.getValue(), retryCount);
        return integration;
    }

    /**
     * 재시도 선점
     * 행 잠금 상태에서 상태/한도를 다시 확인하고 superseded 로 표시한다.
     * 같은 기록에 대한 두 번째 재시도는 (동시든 순차든) 여기서 거부된다.
     */
    @Transactional
    public WorkflowIntegration claimRetry(UUID integrationId) {
        WorkflowIntegration previous = integrationRepository.findByIdForUpdate(integrationId)
                .orElseThrow(() -> new BusinessException(ErrorCode.INTEGRATION_NOT_FOUND,
                        "integrationId=" + integrationId));

        if (previous.getStatus() != IntegrationStatus.FAILED || previous.isSuperseded()) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION, "integrationId=" + integrationId
                    + ", status=" + previous.getStatus() + ", superseded=" + previous.isSuperseded()
                    + ", operation=retry");
        }
        if (!previous.isRetryable()) {
            log.warn("[Integration] 재시도 한도 초과: integrationId={}, retryCount={}/{}",
                    integrationId, previous.getRetryCount(), previous.getMaxRetries());
            throw new BusinessException(ErrorCode.RETRY_LIMIT_EXCEEDED,
                    "integrationId=" + integrationId + ", retryCount=" + previous.getRetryCount());
        }

        previous.markSuperseded();
        return integrationRepository.save(previous);
    }

    /**
     * 호출 성공 기록 (문서 검색이면 찾은 문서도 함께 저장)
     */
    @Transactional
    public WorkflowIntegration recordSuccess(WorkflowIntegration integration, String externalId,
                                             Map<String, Object> response, List<FoundDocument> documents) {
        integration.markCompleted(externalId, response);
        WorkflowIntegration saved = integrationRepository.save(integration);

        if (!documents.isEmpty()) {
            documentRepository.saveAll(documents.stream()
                    .map(document -> WorkflowDocument.builder()
                            .workflowId(integration.getWorkflowId())
                            .stepId(integration.getStepId())
                            .documentName(document.name())
                            .documentType(document.documentType())
                            .storageKey(document.storageKey())
                            .fileType(document.fileType())
                            .fileSize(document.fileSize())
                            .metadata(document.metadata())
                            .build())
                    .toList());
        }

        log.info("[Integration] 호출 성공: integrationId={}, type={}, externalId={}, documents={}",
                integration.getId(), integration.getIntegrationType().getValue(), externalId, documents.size());
        return saved;
    }

    /**
     * 호출 실패 기록 + integration_failure 예외(HIGH) 생성
     */
    @Transactional
    public WorkflowIntegration recordFailure(WorkflowIntegration integration, String error) {
        integration.markFailed(error);
        WorkflowIntegration saved = integrationRepository.save(integration);

        String type = integration.getIntegrationType().getValue();
        exceptionService.raiseException(integration.getWorkflowId(),
                ExceptionDraft.integrationFailure(integration.getStepId(), type, saved.getErrorMessage()));

        log.error("[Integration] 호출 실패: integrationId={}, type={}, retryCount={}/{}, error={}",
                integration.getId(), type, integration.getRetryCount(), integration.getMaxRetries(),
                saved.getErrorMessage());
        return saved;
    }
}
