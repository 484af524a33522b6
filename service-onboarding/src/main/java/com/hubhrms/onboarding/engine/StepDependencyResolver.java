package com.hubhrms.onboarding.engine;

import com.hubhrms.onboarding.entity.WorkflowStep;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 단계 시작 가능 여부 판단
 *
 * <p>이미 로드된 직속 선행 단계 목록만 보고 판단한다 (추이적으로 조회하지 않음).
 * 찾을 수 없는 선행 단계 참조는 미충족으로 본다 (fail closed).</p>
 *
 * <p>순환 의존성은 검사하지 않는다. 템플릿이 코드로 고정되어 있어 런타임에 생길 수 없다.</p>
 */
@Component
public class StepDependencyResolver {

    /**
     * @param step             판단 대상 단계
     * @param dependencySteps  step.dependencies 에 해당하는 단계들 (호출 측에서 로드)
     */
    public boolean isEligible(WorkflowStep step, Collection<WorkflowStep> dependencySteps) {
        return unmetDependencies(step, dependencySteps).isEmpty();
    }

    /**
     * 충족되지 않은 선행 단계 ID (완료/건너뜀이 아니거나 찾을 수 없는 것)
     */
    public List<UUID> unmetDependencies(WorkflowStep step, Collection<WorkflowStep> dependencySteps) {
        if (!step.hasDependencies()) {
            return List.of();
        }

        Map<UUID, WorkflowStep> loaded = dependencySteps.stream()
                .collect(Collectors.toMap(WorkflowStep::getId, Function.identity(), (a, b) -> a));

        return step.getDependencies().stream()
                .filter(dependencyId -> {
                    WorkflowStep dependency = loaded.get(dependencyId);
                    return dependency == null || !dependency.isDone();
                })
                .toList();
    }
}
