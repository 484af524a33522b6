package com.hubhrms.onboarding.template;

import com.hubhrms.onboarding.entity.IntegrationType;
import com.hubhrms.onboarding.entity.OnboardingStage;
import com.hubhrms.onboarding.entity.StepType;

import java.util.List;
import java.util.Map;

/**
 * 템플릿의 단계 정의
 *
 * @param key        템플릿 안에서만 쓰는 식별자 (dependsOn 이 참조)
 * @param dueInDays  시작일 기준 마감 일수
 * @param dependsOn  선행 단계 key 목록. 워크플로우 생성 시 단계 ID 로 바뀐다.
 */
public record StepDefinition(
        String key,
        String name,
        String description,
        StepType stepType,
        OnboardingStage stage,
        IntegrationType integrationType,
        Map<String, Object> integrationConfig,
        int dueInDays,
        List<String> dependsOn
) {
    public StepDefinition {
        integrationConfig = integrationConfig == null ? Map.of() : Map.copyOf(integrationConfig);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public static StepDefinition manual(String key, String name, String description,
                                        OnboardingStage stage, int dueInDays, String... dependsOn) {
        return new StepDefinition(key, name, description, StepType.MANUAL, stage,
                null, Map.of(), dueInDays, List.of(dependsOn));
    }

    public static StepDefinition integration(String key, String name, String description,
                                             OnboardingStage stage, IntegrationType type,
                                             Map<String, Object> config, int dueInDays, String... dependsOn) {
        return new StepDefinition(key, name, description, StepType.INTEGRATION, stage,
                type, config, dueInDays, List.of(dependsOn));
    }
}
