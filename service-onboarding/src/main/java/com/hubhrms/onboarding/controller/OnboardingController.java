package com.hubhrms.onboarding.controller;

import com.hubhrms.common.dto.ApiResponse;
import com.hubhrms.onboarding.service.OnboardingStats;
import com.hubhrms.onboarding.service.OnboardingWorkflowService;
import com.hubhrms.onboarding.template.OnboardingTemplate;
import com.hubhrms.onboarding.template.StepDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/onboarding")
@RequiredArgsConstructor
public class OnboardingController {

    private final OnboardingWorkflowService workflowService;

    @GetMapping("/templates")
    public ApiResponse<List<TemplateResponse>> listTemplates() {
        return ApiResponse.success(workflowService.listTemplates().stream()
                .map(TemplateResponse::from)
                .toList());
    }

    @GetMapping("/stats")
    public ApiResponse<OnboardingStats> getStats() {
        return ApiResponse.success(workflowService.getStats());
    }

    // 응답 DTO
    public record TemplateResponse(String name, String description, List<TemplateStepResponse> steps) {
        public static TemplateResponse from(OnboardingTemplate template) {
            return new TemplateResponse(template.name(), template.description(),
                    template.steps().stream().map(TemplateStepResponse::from).toList());
        }
    }

    public record TemplateStepResponse(
            String key,
            String name,
            String stepType,
            String stage,
            String integrationType,
            int dueInDays,
            List<String> dependsOn
    ) {
        public static TemplateStepResponse from(StepDefinition definition) {
            return new TemplateStepResponse(
                    definition.key(),
                    definition.name(),
                    definition.stepType().name(),
                    definition.stage().getValue(),
                    definition.integrationType() == null ? null : definition.integrationType().getValue(),
                    definition.dueInDays(),
                    definition.dependsOn()
            );
        }
    }
}
