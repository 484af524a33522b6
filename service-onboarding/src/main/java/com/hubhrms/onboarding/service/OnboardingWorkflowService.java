package com.hubhrms.onboarding.service;

import com.hubhrms.common.exception.BusinessException;
import com.hubhrms.common.exception.ErrorCode;
import com.hubhrms.onboarding.client.EmployeeDirectory;
import com.hubhrms.onboarding.client.EmployeeProfile;
import com.hubhrms.onboarding.config.OnboardingProperties;
import com.hubhrms.onboarding.engine.StageAdvancementEngine;
import com.hubhrms.onboarding.engine.StepDependencyResolver;
import com.hubhrms.onboarding.entity.OnboardingWorkflow;
import com.hubhrms.onboarding.entity.ResolutionStatus;
import com.hubhrms.onboarding.entity.WorkflowStatus;
import com.hubhrms.onboarding.entity.WorkflowStep;
import com.hubhrms.onboarding.repository.OnboardingWorkflowRepository;
import com.hubhrms.onboarding.repository.WorkflowDocumentRepository;
import com.hubhrms.onboarding.repository.WorkflowExceptionRepository;
import com.hubhrms.onboarding.repository.WorkflowIntegrationRepository;
import com.hubhrms.onboarding.repository.WorkflowStepRepository;
import com.hubhrms.onboarding.template.OnboardingTemplate;
import com.hubhrms.onboarding.template.WorkflowTemplateCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * 온보딩 워크플로우 오케스트레이터
 *
 * <h2>동시성</h2>
 * <pre>
 * 단계 변경(시작/완료/건너뜀)과 단계 진행은 먼저 워크플로우 행을 잠근 뒤(findByIdForUpdate)
 * 단계를 읽는다. 같은 워크플로우의 마지막 두 단계를 동시에 완료해도
 * 둘 중 하나만 "모두 끝남"을 보고 진행하며, 체크포인트가 두 번 적용되지 않는다.
 * 다른 워크플로우끼리는 공유 상태가 없다.
 * </pre>
 *
 * <h2>종료 상태</h2>
 * COMPLETED / CANCELLED 워크플로우에서는 어떤 단계 연산도 상태를 바꾸지 않는다 (INVALID_TRANSITION).
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class OnboardingWorkflowService {

    private final OnboardingWorkflowRepository workflowRepository;
    private final WorkflowStepRepository stepRepository;
    private final WorkflowIntegrationRepository integrationRepository;
    private final WorkflowExceptionRepository exceptionRepository;
    private final WorkflowDocumentRepository documentRepository;
    private final EmployeeDirectory employeeDirectory;
    private final WorkflowTemplateCatalog templateCatalog;
    private final StepDependencyResolver dependencyResolver;
    private final StageAdvancementEngine stageEngine;
    private final WorkflowExceptionService exceptionService;
    private final OnboardingProperties properties;
    private final Clock clock;

    // ========================================
    // 워크플로우 수명주기
    // ========================================

    /**
     * 온보딩 시작
     * 워크플로우와 템플릿 단계 전체를 한 트랜잭션으로 저장한다. 단계 저장이 실패하면 워크플로우도 남지 않는다.
     */
    @Transactional
    public OnboardingWorkflow initiateWorkflow(UUID employeeId, String templateName, UUID createdBy) {
        EmployeeProfile employee = employeeDirectory.findById(employeeId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EMPLOYEE_NOT_FOUND, "employeeId=" + employeeId));

        OnboardingTemplate template = templateCatalog.resolve(templateName);
        LocalDateTime now = LocalDateTime.now(clock);

        OnboardingWorkflow workflow = OnboardingWorkflow.builder()
                .employeeId(employeeId)
                .employeeName(employee.fullName())
                .employeeEmail(employee.email())
                .templateName(template.name())
                .createdBy(createdBy)
                .startDate(now)
                .expectedCompletionDate(now.plusDays(properties.getExpectedCompletionDays()))
                .build();

        List<WorkflowStep> steps = templateCatalog.generateSteps(template, workflow.getId(), now);

        try {
            workflowRepository.save(workflow);
            stepRepository.saveAllAndFlush(steps);
        } catch (DataAccessException e) {
            log.error("워크플로우 생성 실패 (롤백): employeeId={}, template={}", employeeId, template.name(), e);
            throw new BusinessException(ErrorCode.PERSISTENCE_ERROR,
                    "employeeId=" + employeeId + ", operation=initiateWorkflow", e);
        }

        log.info("온보딩 시작: workflowId={}, employeeId={}, template={}, steps={}",
                workflow.getId(), employeeId, template.name(), steps.size());
        return workflow;
    }

    public WorkflowDetails getWorkflow(UUID workflowId) {
        OnboardingWorkflow workflow = findWorkflow(workflowId);
        return new WorkflowDetails(
                workflow,
                stepRepository.findByWorkflowIdOrderByStepOrderAsc(workflowId),
                exceptionRepository.findByWorkflowIdOrderByCreatedAtDesc(workflowId),
                documentRepository.findByWorkflowIdOrderByCreatedAtAsc(workflowId),
                integrationRepository.findByWorkflowIdOrderByCreatedAtAsc(workflowId)
        );
    }

    public List<OnboardingWorkflow> listWorkflows(WorkflowStatus status, UUID employeeId) {
        if (status != null && employeeId != null) {
            return workflowRepository.findByStatusAndEmployeeIdOrderByCreatedAtDesc(status, employeeId);
        }
        if (status != null) {
            return workflowRepository.findByStatusOrderByCreatedAtDesc(status);
        }
        if (employeeId != null) {
            return workflowRepository.findByEmployeeIdOrderByCreatedAtDesc(employeeId);
        }
        return workflowRepository.findAllByOrderByCreatedAtDesc();
    }

    /**
     * 워크플로우 취소 (되돌릴 수 없음, 단계는 그대로 둔다)
     * 진행 중인 외부 호출은 기다리지 않는다. 그 호출의 기록은 나중에 그대로 저장된다.
     */
    @Transactional
    public OnboardingWorkflow cancelWorkflow(UUID workflowId) {
        OnboardingWorkflow workflow = lockWorkflow(workflowId);
        requireActive(workflow, "cancelWorkflow");

        workflow.cancel();
        log.info("온보딩 취소: workflowId={}, stage={}", workflowId, workflow.getCurrentStage().getValue());
        return workflow;
    }

    /**
     * 수동 단계 진행 (step 상태와 무관하게 한 단계)
     */
    @Transactional
    public OnboardingWorkflow advanceStage(UUID workflowId) {
        stageEngine.forceAdvance(workflowId);
        return findWorkflow(workflowId);
    }

    // ========================================
    // 단계(step) 수명주기
    // ========================================

    /**
     * 단계 시작 - 선행 단계가 모두 완료/건너뜀이어야 한다
     */
    @Transactional
    public WorkflowStep startStep(UUID stepId) {
        WorkflowStep step = lockWorkflowAndLoadStep(stepId, "startStep");

        if (step.isDone()) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "stepId=" + stepId + ", status=" + step.getStatus() + ", operation=startStep");
        }

        List<UUID> unmet = dependencyResolver.unmetDependencies(step, stepRepository.findAllById(step.getDependencies()));
        if (!unmet.isEmpty()) {
            log.warn("선행 단계 미완료: stepId={}, unmetDependencies={}", stepId, unmet);
            throw new BusinessException(ErrorCode.DEPENDENCY_NOT_MET, "stepId=" + stepId + ", unmet=" + unmet);
        }

        step.start(LocalDateTime.now(clock));
        log.info("단계 시작: stepId={}, workflowId={}, name={}", stepId, step.getWorkflowId(), step.getStepName());
        return step;
    }

    /**
     * 단계 완료 후 단계 진행 검사 (워크플로우 진행률이 바뀌는 유일한 자동 경로)
     */
    @Transactional
    public WorkflowStep completeStep(UUID stepId, UUID completedBy) {
        WorkflowStep step = lockWorkflowAndLoadStep(stepId, "completeStep");
        requireNotDone(step, "completeStep");

        step.complete(completedBy, LocalDateTime.now(clock));
        log.info("단계 완료: stepId={}, workflowId={}, completedBy={}", stepId, step.getWorkflowId(), completedBy);

        stageEngine.maybeAdvanceStage(step.getWorkflowId());
        return step;
    }

    /**
     * 단계 건너뜀 - 의존성/단계 완료 판단에서 완료와 같게 취급된다
     */
    @Transactional
    public WorkflowStep skipStep(UUID stepId, UUID userId, String reason) {
        WorkflowStep step = lockWorkflowAndLoadStep(stepId, "skipStep");
        requireNotDone(step, "skipStep");

        step.skip(userId, reason, LocalDateTime.now(clock));
        log.info("단계 건너뜀: stepId={}, workflowId={}, skippedBy={}, reason={}",
                stepId, step.getWorkflowId(), userId, reason);

        stageEngine.maybeAdvanceStage(step.getWorkflowId());
        return step;
    }

    // ========================================
    // 조회
    // ========================================

    public WorkflowProgress checkWorkflowProgress(UUID workflowId) {
        OnboardingWorkflow workflow = findWorkflow(workflowId);
        List<WorkflowStep> steps = stepRepository.findByWorkflowIdOrderByStepOrderAsc(workflowId);
        long openExceptions = exceptionService.countOpenExceptions(workflowId);
        return WorkflowProgress.calculate(workflow, steps, openExceptions, LocalDateTime.now(clock));
    }

    public List<OnboardingTemplate> listTemplates() {
        return templateCatalog.list();
    }

    /**
     * 진행 중 워크플로우 수, 이번 달 완료 수와 평균 소요 일수, 열린 예외 수
     */
    public OnboardingStats getStats() {
        LocalDateTime monthStart = LocalDateTime.now(clock).toLocalDate().withDayOfMonth(1).atStartOfDay();
        List<OnboardingWorkflow> completedThisMonth = workflowRepository
                .findByStatusAndActualCompletionDateGreaterThanEqual(WorkflowStatus.COMPLETED, monthStart);

        long averageDays = Math.round(completedThisMonth.stream()
                .mapToLong(workflow -> ChronoUnit.DAYS.between(workflow.getStartDate(), workflow.getActualCompletionDate()))
                .average()
                .orElse(0));

        return new OnboardingStats(
                templateCatalog.list().size(),
                workflowRepository.countByStatus(WorkflowStatus.IN_PROGRESS),
                completedThisMonth.size(),
                averageDays,
                exceptionRepository.countByResolutionStatusNot(ResolutionStatus.RESOLVED)
        );
    }

    // ========================================
    // 내부 헬퍼
    // ========================================

    private OnboardingWorkflow findWorkflow(UUID workflowId) {
        return workflowRepository.findById(workflowId)
                .orElseThrow(() -> new BusinessException(ErrorCode.WORKFLOW_NOT_FOUND, "workflowId=" + workflowId));
    }

    private OnboardingWorkflow lockWorkflow(UUID workflowId) {
        return workflowRepository.findByIdForUpdate(workflowId)
                .orElseThrow(() -> new BusinessException(ErrorCode.WORKFLOW_NOT_FOUND, "workflowId=" + workflowId));
    }

    /**
     * 워크플로우 잠금 → 단계 로드 순서를 지켜서 잠금 이후의 단계 상태를 본다
     */
    private WorkflowStep lockWorkflowAndLoadStep(UUID stepId, String operation) {
        UUID workflowId = stepRepository.findWorkflowIdByStepId(stepId)
                .orElseThrow(() -> new BusinessException(ErrorCode.STEP_NOT_FOUND, "stepId=" + stepId));

        OnboardingWorkflow workflow = lockWorkflow(workflowId);
        requireActive(workflow, operation);

        return stepRepository.findById(stepId)
                .orElseThrow(() -> new BusinessException(ErrorCode.STEP_NOT_FOUND, "stepId=" + stepId));
    }

    private void requireActive(OnboardingWorkflow workflow, String operation) {
        if (workflow.isTerminal()) {
            log.warn("종료된 워크플로우 연산 거부: workflowId={}, status={}, operation={}",
                    workflow.getId(), workflow.getStatus(), operation);
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "workflowId=" + workflow.getId() + ", status=" + workflow.getStatus() + ", operation=" + operation);
        }
    }

    private void requireNotDone(WorkflowStep step, String operation) {
        if (step.isDone()) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "stepId=" + step.getId() + ", status=" + step.getStatus() + ", operation=" + operation);
        }
    }
}
