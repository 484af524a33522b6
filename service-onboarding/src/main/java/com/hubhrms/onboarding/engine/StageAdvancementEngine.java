package com.hubhrms.onboarding.engine;

import com.hubhrms.common.exception.BusinessException;
import com.hubhrms.common.exception.ErrorCode;
import com.hubhrms.onboarding.entity.OnboardingStage;
import com.hubhrms.onboarding.entity.OnboardingWorkflow;
import com.hubhrms.onboarding.entity.WorkflowStep;
import com.hubhrms.onboarding.repository.OnboardingWorkflowRepository;
import com.hubhrms.onboarding.repository.WorkflowStepRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 단계 진행 엔진
 *
 * <h2>규칙</h2>
 * <pre>
 * 1. 현재 단계에 속한 단계(step)가 모두 COMPLETED/SKIPPED 이면 다음 단계로 진행
 * 2. 현재 단계에 step 이 하나도 없으면 "모두 끝남"으로 본다
 * 3. 한 번 호출에 최대 한 단계만 진행한다 (연쇄 진행 없음)
 * 4. 진입한 단계의 BLOCKED step 은 PENDING 으로 풀어준다
 * 5. 종료(완료/취소)된 워크플로우는 건드리지 않는다
 * </pre>
 *
 * <p>워크플로우 행을 PESSIMISTIC_WRITE 로 읽으므로 같은 워크플로우에 대한 "step 조회 → 진행"은
 * 트랜잭션 단위로 직렬화된다. 호출 측 트랜잭션 안에서 실행되어야 한다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StageAdvancementEngine {

    private final OnboardingWorkflowRepository workflowRepository;
    private final WorkflowStepRepository stepRepository;
    private final Clock clock;

    /**
     * 단계 완료/건너뜀 직후 호출
     *
     * @return 진행했으면 새 단계, 아니면 empty
     */
    @Transactional
    public Optional<OnboardingStage> maybeAdvanceStage(UUID workflowId) {
        OnboardingWorkflow workflow = lockWorkflow(workflowId);

        if (workflow.isTerminal()) {
            log.debug("종료된 워크플로우, 단계 진행 생략: workflowId={}, status={}", workflowId, workflow.getStatus());
            return Optional.empty();
        }

        OnboardingStage current = workflow.getCurrentStage();
        List<WorkflowStep> steps = stepRepository.findByWorkflowIdOrderByStepOrderAsc(workflowId);

        boolean allDone = steps.stream()
                .filter(step -> step.getStage() == current)
                .allMatch(WorkflowStep::isDone);

        if (!allDone) {
            return Optional.empty();
        }

        return Optional.of(advance(workflow, steps));
    }

    /**
     * 수동 진행 (운영자 override) - step 상태와 무관하게 한 단계 진행
     */
    @Transactional
    public OnboardingStage forceAdvance(UUID workflowId) {
        OnboardingWorkflow workflow = lockWorkflow(workflowId);

        if (workflow.isTerminal()) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "workflowId=" + workflowId + ", status=" + workflow.getStatus() + ", operation=advanceStage");
        }

        List<WorkflowStep> steps = stepRepository.findByWorkflowIdOrderByStepOrderAsc(workflowId);
        OnboardingStage next = advance(workflow, steps);
        log.info("단계 수동 진행: workflowId={}, stage={}", workflowId, next.getValue());
        return next;
    }

    private OnboardingStage advance(OnboardingWorkflow workflow, List<WorkflowStep> steps) {
        OnboardingStage from = workflow.getCurrentStage();
        OnboardingStage next = from.next();
        workflow.advanceTo(next, LocalDateTime.now(clock));

        int unblocked = 0;
        for (WorkflowStep step : steps) {
            if (step.getStage() == next && step.unblock()) {
                unblocked++;
            }
        }

        log.info("단계 진행: workflowId={}, from={}, to={}, progress={}, unblockedSteps={}",
                workflow.getId(), from.getValue(), next.getValue(), workflow.getOverallProgress(), unblocked);

        if (next.isFinal()) {
            log.info("온보딩 완료: workflowId={}, completedAt={}", workflow.getId(), workflow.getActualCompletionDate());
        }
        return next;
    }

    private OnboardingWorkflow lockWorkflow(UUID workflowId) {
        return workflowRepository.findByIdForUpdate(workflowId)
                .orElseThrow(() -> new BusinessException(ErrorCode.WORKFLOW_NOT_FOUND, "workflowId=" + workflowId));
    }
}
