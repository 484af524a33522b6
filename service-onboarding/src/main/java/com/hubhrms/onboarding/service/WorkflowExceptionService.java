package com.hubhrms.onboarding.service;

import com.hubhrms.common.exception.BusinessException;
import com.hubhrms.common.exception.ErrorCode;
import com.hubhrms.onboarding.entity.ResolutionStatus;
import com.hubhrms.onboarding.entity.WorkflowException;
import com.hubhrms.onboarding.entity.WorkflowStep;
import com.hubhrms.onboarding.repository.OnboardingWorkflowRepository;
import com.hubhrms.onboarding.repository.WorkflowExceptionRepository;
import com.hubhrms.onboarding.repository.WorkflowStepRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * 워크플로우 예외 생성/해결
 *
 * 열린(OPEN/IN_PROGRESS) 예외가 "온보딩에 사람 손이 필요하다"는 신호다.
 * 대시보드는 {@link #listOpenExceptions()} 를 폴링한다.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class WorkflowExceptionService {

    private final WorkflowExceptionRepository exceptionRepository;
    private final OnboardingWorkflowRepository workflowRepository;
    private final WorkflowStepRepository stepRepository;
    private final Clock clock;

    /**
     * 예외 생성 (항상 OPEN 으로 시작)
     */
    @Transactional
    public WorkflowException raiseException(UUID workflowId, ExceptionDraft draft) {
        if (!workflowRepository.existsById(workflowId)) {
            throw new BusinessException(ErrorCode.WORKFLOW_NOT_FOUND, "workflowId=" + workflowId);
        }
        if (draft.stepId() != null) {
            WorkflowStep step = stepRepository.findById(draft.stepId())
                    .orElseThrow(() -> new BusinessException(ErrorCode.STEP_NOT_FOUND, "stepId=" + draft.stepId()));
            if (!step.getWorkflowId().equals(workflowId)) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "stepId=" + draft.stepId() + " 는 workflowId=" + workflowId + " 소속이 아닙니다");
            }
        }

        WorkflowException exception = exceptionRepository.save(WorkflowException.builder()
                .workflowId(workflowId)
                .stepId(draft.stepId())
                .exceptionType(draft.exceptionType())
                .severity(draft.severity())
                .title(draft.title())
                .description(draft.description())
                .assignedTo(draft.assignedTo())
                .build());

        log.warn("워크플로우 예외 생성: exceptionId={}, workflowId={}, stepId={}, type={}, severity={}, title={}",
                exception.getId(), workflowId, draft.stepId(), exception.getExceptionType(),
                exception.getSeverity(), exception.getTitle());
        return exception;
    }

    /**
     * 예외 해결
     * 이미 해결된 예외면 아무것도 바꾸지 않고 기존 해결 정보를 그대로 돌려준다 (first-writer-wins).
     */
    @Transactional
    public WorkflowException resolveException(UUID exceptionId, UUID resolvedBy, String notes) {
        WorkflowException exception = exceptionRepository.findByIdForUpdate(exceptionId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EXCEPTION_NOT_FOUND, "exceptionId=" + exceptionId));

        if (exception.resolve(resolvedBy, notes, LocalDateTime.now(clock))) {
            log.info("워크플로우 예외 해결: exceptionId={}, resolvedBy={}", exceptionId, resolvedBy);
        } else {
            log.info("이미 해결된 예외, 변경 없음: exceptionId={}, resolvedBy={}",
                    exceptionId, exception.getResolvedBy());
        }
        return exception;
    }

    public List<WorkflowException> listExceptions(UUID workflowId) {
        return exceptionRepository.findByWorkflowIdOrderByCreatedAtDesc(workflowId);
    }

    public List<WorkflowException> listOpenExceptions() {
        return exceptionRepository.findByResolutionStatusNotOrderByCreatedAtDesc(ResolutionStatus.RESOLVED);
    }

    public long countOpenExceptions(UUID workflowId) {
        return exceptionRepository.countByWorkflowIdAndResolutionStatusNot(workflowId, ResolutionStatus.RESOLVED);
    }
}
