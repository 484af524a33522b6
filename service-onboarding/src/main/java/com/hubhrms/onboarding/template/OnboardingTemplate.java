package com.hubhrms.onboarding.template;

import java.util.List;

/**
 * 코드로 정의된 온보딩 템플릿 (이름 → 단계 정의 목록)
 */
public record OnboardingTemplate(
        String name,
        String description,
        List<StepDefinition> steps
) {
    public OnboardingTemplate {
        steps = List.copyOf(steps);
    }
}
