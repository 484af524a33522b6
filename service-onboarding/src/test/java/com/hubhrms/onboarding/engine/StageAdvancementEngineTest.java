package com.hubhrms.onboarding.engine;

import com.hubhrms.common.exception.BusinessException;
import com.hubhrms.common.exception.ErrorCode;
import com.hubhrms.onboarding.entity.OnboardingStage;
import com.hubhrms.onboarding.entity.OnboardingWorkflow;
import com.hubhrms.onboarding.entity.StepStatus;
import com.hubhrms.onboarding.entity.StepType;
import com.hubhrms.onboarding.entity.WorkflowStatus;
import com.hubhrms.onboarding.entity.WorkflowStep;
import com.hubhrms.onboarding.repository.OnboardingWorkflowRepository;
import com.hubhrms.onboarding.repository.WorkflowStepRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class StageAdvancementEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-04T09:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Autowired
    private OnboardingWorkflowRepository workflowRepository;

    @Autowired
    private WorkflowStepRepository stepRepository;

    private StageAdvancementEngine engine;

    @BeforeEach
    void setUp() {
        engine = new StageAdvancementEngine(workflowRepository, stepRepository, CLOCK);
    }

    @Test
    @DisplayName("현재 단계의 step 이 모두 끝나면 다음 단계로 진행하고 그 단계의 BLOCKED step 을 푼다")
    void allStepsDone_advancesAndUnblocks() {
        OnboardingWorkflow workflow = saveWorkflow();
        WorkflowStep offer = saveStep(workflow, 1, OnboardingStage.PRE_BOARDING, StepStatus.PENDING);
        WorkflowStep i9 = saveStep(workflow, 2, OnboardingStage.PRE_BOARDING, StepStatus.PENDING);
        WorkflowStep welcome = saveStep(workflow, 3, OnboardingStage.DAY_1, StepStatus.BLOCKED, offer, i9);
        WorkflowStep review = saveStep(workflow, 4, OnboardingStage.MONTH_1, StepStatus.BLOCKED, welcome);

        offer.complete(UUID.randomUUID(), NOW);
        assertThat(engine.maybeAdvanceStage(workflow.getId())).isEmpty();
        assertThat(workflow.getCurrentStage()).isEqualTo(OnboardingStage.PRE_BOARDING);

        i9.skip(UUID.randomUUID(), "해외 근무자", NOW);
        assertThat(engine.maybeAdvanceStage(workflow.getId())).contains(OnboardingStage.DAY_1);

        assertThat(workflow.getCurrentStage()).isEqualTo(OnboardingStage.DAY_1);
        assertThat(workflow.getOverallProgress()).isEqualTo(25);
        assertThat(welcome.getStatus()).isEqualTo(StepStatus.PENDING);
        assertThat(review.getStatus()).isEqualTo(StepStatus.BLOCKED);
    }

    @Test
    @DisplayName("진입한 단계에서 이미 PENDING 이거나 진행 중인 step 은 그대로 둔다")
    void advance_onlyUnblocksBlockedSteps() {
        OnboardingWorkflow workflow = saveWorkflow();
        WorkflowStep offer = saveStep(workflow, 1, OnboardingStage.PRE_BOARDING, StepStatus.PENDING);
        WorkflowStep blocked = saveStep(workflow, 2, OnboardingStage.DAY_1, StepStatus.BLOCKED, offer);
        WorkflowStep pending = saveStep(workflow, 3, OnboardingStage.DAY_1, StepStatus.PENDING);
        WorkflowStep started = saveStep(workflow, 4, OnboardingStage.DAY_1, StepStatus.PENDING);
        started.start(NOW);

        offer.complete(UUID.randomUUID(), NOW);
        engine.maybeAdvanceStage(workflow.getId());

        assertThat(blocked.getStatus()).isEqualTo(StepStatus.PENDING);
        assertThat(pending.getStatus()).isEqualTo(StepStatus.PENDING);
        assertThat(started.getStatus()).isEqualTo(StepStatus.IN_PROGRESS);
        assertThat(started.getStartedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("다음 단계에 step 이 없어도 한 번에 한 단계만 진행한다")
    void emptyStages_advanceOneAtATime() {
        OnboardingWorkflow workflow = saveWorkflow();

        assertThat(engine.maybeAdvanceStage(workflow.getId())).contains(OnboardingStage.DAY_1);
        assertThat(workflow.getCurrentStage()).isEqualTo(OnboardingStage.DAY_1);
        assertThat(workflow.getOverallProgress()).isEqualTo(25);

        assertThat(engine.maybeAdvanceStage(workflow.getId())).contains(OnboardingStage.WEEK_1);
        assertThat(workflow.getOverallProgress()).isEqualTo(50);
    }

    @Test
    @DisplayName("month-1 이 끝나면 completed 로 진행하고 워크플로우가 완료된다")
    void lastStageDone_completesWorkflow() {
        OnboardingWorkflow workflow = OnboardingWorkflow.builder()
                .employeeId(UUID.randomUUID())
                .employeeName("Jordan Lee")
                .employeeEmail("jordan.lee@example.com")
                .templateName("generic")
                .createdBy(UUID.randomUUID())
                .startDate(NOW.minusDays(28))
                .expectedCompletionDate(NOW.plusDays(2))
                .build();
        workflow.advanceTo(OnboardingStage.DAY_1, NOW);
        workflow.advanceTo(OnboardingStage.WEEK_1, NOW);
        workflow.advanceTo(OnboardingStage.MONTH_1, NOW);
        workflowRepository.save(workflow);
        WorkflowStep review = saveStep(workflow, 1, OnboardingStage.MONTH_1, StepStatus.PENDING);

        review.complete(UUID.randomUUID(), NOW);
        assertThat(engine.maybeAdvanceStage(workflow.getId())).contains(OnboardingStage.COMPLETED);

        assertThat(workflow.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(workflow.getOverallProgress()).isEqualTo(100);
        assertThat(workflow.getActualCompletionDate()).isEqualTo(NOW);

        assertThat(engine.maybeAdvanceStage(workflow.getId())).isEmpty();
        assertThat(workflow.getCurrentStage()).isEqualTo(OnboardingStage.COMPLETED);
    }

    @Test
    @DisplayName("취소된 워크플로우는 진행 검사를 해도 아무것도 바뀌지 않는다")
    void cancelledWorkflow_isInert() {
        OnboardingWorkflow workflow = saveWorkflow();
        WorkflowStep offer = saveStep(workflow, 1, OnboardingStage.PRE_BOARDING, StepStatus.PENDING);
        WorkflowStep welcome = saveStep(workflow, 2, OnboardingStage.DAY_1, StepStatus.BLOCKED, offer);
        offer.complete(UUID.randomUUID(), NOW);
        workflow.cancel();

        assertThat(engine.maybeAdvanceStage(workflow.getId())).isEmpty();

        assertThat(workflow.getCurrentStage()).isEqualTo(OnboardingStage.PRE_BOARDING);
        assertThat(workflow.getOverallProgress()).isZero();
        assertThat(welcome.getStatus()).isEqualTo(StepStatus.BLOCKED);
    }

    @Test
    @DisplayName("수동 진행은 step 상태와 무관하게 한 단계 진행하고, 종료된 워크플로우에는 거부된다")
    void forceAdvance() {
        OnboardingWorkflow workflow = saveWorkflow();
        saveStep(workflow, 1, OnboardingStage.PRE_BOARDING, StepStatus.PENDING);
        WorkflowStep welcome = saveStep(workflow, 2, OnboardingStage.DAY_1, StepStatus.BLOCKED);

        assertThat(engine.forceAdvance(workflow.getId())).isEqualTo(OnboardingStage.DAY_1);
        assertThat(welcome.getStatus()).isEqualTo(StepStatus.PENDING);

        workflow.cancel();
        assertThatThrownBy(() -> engine.forceAdvance(workflow.getId()))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_TRANSITION));
        assertThat(workflow.getCurrentStage()).isEqualTo(OnboardingStage.DAY_1);
    }

    @Test
    @DisplayName("존재하지 않는 워크플로우는 WORKFLOW_NOT_FOUND")
    void unknownWorkflow_notFound() {
        assertThatThrownBy(() -> engine.maybeAdvanceStage(UUID.randomUUID()))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.WORKFLOW_NOT_FOUND));
    }

    private OnboardingWorkflow saveWorkflow() {
        return workflowRepository.save(OnboardingWorkflow.builder()
                .employeeId(UUID.randomUUID())
                .employeeName("Jordan Lee")
                .employeeEmail("jordan.lee@example.com")
                .templateName("generic")
                .createdBy(UUID.randomUUID())
                .startDate(NOW)
                .expectedCompletionDate(NOW.plusDays(30))
                .build());
    }

    private WorkflowStep saveStep(OnboardingWorkflow workflow, int order, OnboardingStage stage,
                                  StepStatus status, WorkflowStep... dependencies) {
        return stepRepository.save(WorkflowStep.builder()
                .workflowId(workflow.getId())
                .stepOrder(order)
                .stepName("step-" + order)
                .stepType(StepType.MANUAL)
                .stage(stage)
                .status(status)
                .dependencies(List.of(dependencies).stream().map(WorkflowStep::getId).toList())
                .dueDate(NOW.plusDays(order))
                .build());
    }
}
