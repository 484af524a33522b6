package com.hubhrms.onboarding.engine;

import com.hubhrms.onboarding.entity.OnboardingStage;
import com.hubhrms.onboarding.entity.StepStatus;
import com.hubhrms.onboarding.entity.StepType;
import com.hubhrms.onboarding.entity.WorkflowStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class StepDependencyResolverTest {

    private final StepDependencyResolver resolver = new StepDependencyResolver();
    private final UUID workflowId = UUID.randomUUID();

    @Test
    @DisplayName("선행 단계가 없으면 항상 시작 가능")
    void noDependencies_eligible() {
        WorkflowStep step = step(StepStatus.PENDING);

        assertThat(resolver.isEligible(step, List.of())).isTrue();
    }

    @Test
    @DisplayName("선행 단계가 모두 완료 또는 건너뜀이면 시작 가능")
    void completedAndSkipped_eligible() {
        WorkflowStep completed = step(StepStatus.PENDING);
        completed.complete(UUID.randomUUID(), LocalDateTime.now());
        WorkflowStep skipped = step(StepStatus.PENDING);
        skipped.skip(UUID.randomUUID(), "해당 없음", LocalDateTime.now());

        WorkflowStep step = step(StepStatus.BLOCKED, completed.getId(), skipped.getId());

        assertThat(resolver.isEligible(step, List.of(completed, skipped))).isTrue();
    }

    @Test
    @DisplayName("진행 중이거나 대기 중인 선행 단계는 미충족으로 돌려준다")
    void unfinishedDependency_unmet() {
        WorkflowStep done = step(StepStatus.PENDING);
        done.complete(UUID.randomUUID(), LocalDateTime.now());
        WorkflowStep inProgress = step(StepStatus.PENDING);
        inProgress.start(LocalDateTime.now());

        WorkflowStep step = step(StepStatus.BLOCKED, done.getId(), inProgress.getId());

        assertThat(resolver.unmetDependencies(step, List.of(done, inProgress)))
                .containsExactly(inProgress.getId());
        assertThat(resolver.isEligible(step, List.of(done, inProgress))).isFalse();
    }

    @Test
    @DisplayName("찾을 수 없는 선행 단계 참조는 미충족 (fail closed)")
    void missingDependency_unmet() {
        UUID dangling = UUID.randomUUID();
        WorkflowStep step = step(StepStatus.BLOCKED, dangling);

        assertThat(resolver.unmetDependencies(step, List.of())).containsExactly(dangling);
    }

    private WorkflowStep step(StepStatus status, UUID... dependencies) {
        return WorkflowStep.builder()
                .workflowId(workflowId)
                .stepOrder(1)
                .stepName("step")
                .stepType(StepType.MANUAL)
                .stage(OnboardingStage.PRE_BOARDING)
                .status(status)
                .dependencies(List.of(dependencies))
                .build();
    }
}
