package com.hubhrms.onboarding.template;

import com.hubhrms.onboarding.entity.OnboardingStage;
import com.hubhrms.onboarding.entity.StepStatus;
import com.hubhrms.onboarding.entity.WorkflowStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.hubhrms.onboarding.entity.IntegrationType.BACKGROUND_CHECK;
import static com.hubhrms.onboarding.entity.IntegrationType.DOCUSIGN;
import static com.hubhrms.onboarding.entity.IntegrationType.DOC_SEARCH;
import static com.hubhrms.onboarding.entity.OnboardingStage.DAY_1;
import static com.hubhrms.onboarding.entity.OnboardingStage.MONTH_1;
import static com.hubhrms.onboarding.entity.OnboardingStage.PRE_BOARDING;
import static com.hubhrms.onboarding.entity.OnboardingStage.WEEK_1;
import static com.hubhrms.onboarding.template.StepDefinition.integration;
import static com.hubhrms.onboarding.template.StepDefinition.manual;

/**
 * 온보딩 템플릿 카탈로그
 *
 * <p>템플릿은 코드로 고정되어 있고 사용자가 편집할 수 없다. 그래서 의존성 순환 검사는 하지 않는다.
 * 템플릿을 편집 가능하게 바꾸면 저장 시점에 위상 정렬로 순환을 막아야 한다.</p>
 *
 * <p>알 수 없는 템플릿 이름은 {@value #GENERIC} 으로 대체한다.</p>
 */
@Slf4j
@Component
public class WorkflowTemplateCatalog {

    public static final String GENERIC = "generic";

    private final Map<String, OnboardingTemplate> templates = new LinkedHashMap<>();

    public WorkflowTemplateCatalog() {
        register(generic());
        register(softwareEngineer());
        register(salesRepresentative());
        register(manager());
    }

    public List<OnboardingTemplate> list() {
        return List.copyOf(templates.values());
    }

    public boolean contains(String name) {
        return name != null && templates.containsKey(name);
    }

    /**
     * 이름으로 템플릿 조회, 없으면 generic
     */
    public OnboardingTemplate resolve(String name) {
        OnboardingTemplate template = name == null ? null : templates.get(name);
        if (template == null) {
            log.warn("알 수 없는 템플릿, generic 으로 대체: templateName={}", name);
            return templates.get(GENERIC);
        }
        return template;
    }

    /**
     * 템플릿으로 워크플로우 단계 생성
     *
     * <pre>
     * - 단계 ID 를 먼저 발급하고 dependsOn key 를 ID 로 바꾼다
     * - 첫 단계(pre-boarding)이면서 선행 단계가 없으면 PENDING, 나머지는 BLOCKED
     * </pre>
     */
    public List<WorkflowStep> generateSteps(OnboardingTemplate template, UUID workflowId, LocalDateTime startDate) {
        Map<String, UUID> idsByKey = new HashMap<>();
        template.steps().forEach(definition -> idsByKey.put(definition.key(), UUID.randomUUID()));

        List<WorkflowStep> steps = new ArrayList<>();
        int order = 1;
        for (StepDefinition definition : template.steps()) {
            List<UUID> dependencies = definition.dependsOn().stream()
                    .map(key -> {
                        UUID dependencyId = idsByKey.get(key);
                        if (dependencyId == null) {
                            throw new IllegalStateException("템플릿 " + template.name() + " 의 단계 "
                                    + definition.key() + " 가 정의되지 않은 단계를 참조: " + key);
                        }
                        return dependencyId;
                    })
                    .toList();

            steps.add(WorkflowStep.builder()
                    .id(idsByKey.get(definition.key()))
                    .workflowId(workflowId)
                    .stepOrder(order++)
                    .stepName(definition.name())
                    .description(definition.description())
                    .stepType(definition.stepType())
                    .stage(definition.stage())
                    .integrationType(definition.integrationType())
                    .integrationConfig(definition.integrationConfig())
                    .status(initialStatus(definition))
                    .dependencies(dependencies)
                    .dueDate(startDate.plusDays(definition.dueInDays()))
                    .build());
        }
        return steps;
    }

    private StepStatus initialStatus(StepDefinition definition) {
        boolean firstStage = definition.stage() == OnboardingStage.PRE_BOARDING;
        return firstStage && definition.dependsOn().isEmpty() ? StepStatus.PENDING : StepStatus.BLOCKED;
    }

    private void register(OnboardingTemplate template) {
        templates.put(template.name(), template);
    }

    // ========================================
    // 템플릿 정의
    // ========================================

    private static OnboardingTemplate generic() {
        return new OnboardingTemplate(GENERIC, "기본 온보딩", List.of(
                integration("offer-letter", "Send Offer Letter", "Send offer letter for e-signature",
                        PRE_BOARDING, DOCUSIGN, Map.of("document_type", "offer-letter"), 1),
                integration("i9-form", "Send I-9 Form", "Send I-9 employment eligibility form",
                        PRE_BOARDING, DOCUSIGN, Map.of("document_type", "i9"), 3),
                manual("welcome-email", "Welcome Email", "Send welcome email",
                        DAY_1, 7, "offer-letter", "i9-form"),
                manual("office-tour", "Office Tour", "Conduct office tour",
                        DAY_1, 7, "offer-letter", "i9-form")
        ));
    }

    private static OnboardingTemplate softwareEngineer() {
        return new OnboardingTemplate("software-engineer", "개발자 온보딩", List.of(
                integration("offer-letter", "Send Offer Letter", "Send offer letter for e-signature",
                        PRE_BOARDING, DOCUSIGN, Map.of("document_type", "offer-letter"), 1),
                integration("i9-form", "Send I-9 Form", "Send I-9 employment eligibility form",
                        PRE_BOARDING, DOCUSIGN, Map.of("document_type", "i9"), 3),
                integration("background-check", "Background Check", "Criminal, employment and education check",
                        PRE_BOARDING, BACKGROUND_CHECK,
                        Map.of("check_types", List.of("criminal", "employment", "education")), 5),
                manual("dev-environment", "Development Environment Setup",
                        "Install required development tools and access",
                        DAY_1, 8, "offer-letter", "i9-form", "background-check"),
                manual("repository-access", "Code Repository Access", "Grant access to source repositories",
                        DAY_1, 8, "background-check"),
                integration("engineering-docs", "Engineering Onboarding Docs", "Collect engineering onboarding guides",
                        WEEK_1, DOC_SEARCH, Map.of("query", "onboarding"), 10),
                manual("codebase-walkthrough", "Codebase Walkthrough", "Architecture walkthrough with a senior engineer",
                        WEEK_1, 14, "dev-environment", "repository-access"),
                manual("first-review", "30-Day Check-in", "First month review with manager",
                        MONTH_1, 30, "codebase-walkthrough")
        ));
    }

    private static OnboardingTemplate salesRepresentative() {
        return new OnboardingTemplate("sales-representative", "영업 담당자 온보딩", List.of(
                integration("offer-letter", "Send Offer Letter", "Send offer letter for e-signature",
                        PRE_BOARDING, DOCUSIGN, Map.of("document_type", "offer-letter"), 1),
                integration("i9-form", "Send I-9 Form", "Send I-9 employment eligibility form",
                        PRE_BOARDING, DOCUSIGN, Map.of("document_type", "i9"), 3),
                integration("background-check", "Background Check", "Criminal and employment check",
                        PRE_BOARDING, BACKGROUND_CHECK,
                        Map.of("check_types", List.of("criminal", "employment")), 5),
                manual("crm-setup", "CRM Account Setup", "Provision CRM account and pipeline views",
                        DAY_1, 8, "offer-letter", "i9-form"),
                manual("welcome-email", "Welcome Email", "Send welcome email",
                        DAY_1, 8, "offer-letter", "i9-form"),
                integration("sales-playbook", "Sales Training Materials", "Collect sales playbook and training",
                        WEEK_1, DOC_SEARCH, Map.of("query", "sales"), 10),
                manual("territory-assignment", "Territory Assignment", "Assign accounts and territory",
                        WEEK_1, 14, "crm-setup"),
                manual("pipeline-review", "30-Day Pipeline Review", "Review first month pipeline with manager",
                        MONTH_1, 30, "territory-assignment")
        ));
    }

    private static OnboardingTemplate manager() {
        return new OnboardingTemplate("manager", "관리자 온보딩", List.of(
                integration("offer-letter", "Send Offer Letter", "Send offer letter for e-signature",
                        PRE_BOARDING, DOCUSIGN, Map.of("document_type", "offer-letter"), 1),
                integration("i9-form", "Send I-9 Form", "Send I-9 employment eligibility form",
                        PRE_BOARDING, DOCUSIGN, Map.of("document_type", "i9"), 3),
                integration("background-check", "Background Check", "Criminal, employment and education check",
                        PRE_BOARDING, BACKGROUND_CHECK,
                        Map.of("check_types", List.of("criminal", "employment", "education")), 5),
                manual("welcome-email", "Welcome Email", "Send welcome email",
                        DAY_1, 8, "offer-letter", "i9-form"),
                manual("team-introductions", "Team Introductions", "Meet direct reports and peer managers",
                        DAY_1, 8, "offer-letter", "i9-form", "background-check"),
                integration("leadership-policies", "Leadership Policies", "Collect manager policy documents",
                        WEEK_1, DOC_SEARCH, Map.of("query", "policy"), 10),
                manual("one-on-ones", "Direct Report 1:1s", "Hold first 1:1 with every direct report",
                        WEEK_1, 14, "team-introductions"),
                manual("manager-review", "30-Day Leadership Review", "First month review with skip-level manager",
                        MONTH_1, 30, "one-on-ones")
        ));
    }
}
