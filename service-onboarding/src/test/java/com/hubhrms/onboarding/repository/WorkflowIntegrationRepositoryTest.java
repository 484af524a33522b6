package com.hubhrms.onboarding.repository;

import com.hubhrms.onboarding.entity.IntegrationType;
import com.hubhrms.onboarding.entity.WorkflowIntegration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class WorkflowIntegrationRepositoryTest {

    @Autowired
    private WorkflowIntegrationRepository integrationRepository;

    private final UUID workflowId = UUID.randomUUID();
    private final UUID stepId = UUID.randomUUID();

    @Test
    @DisplayName("재시도 대상 목록에는 이미 재시도된 기록, 한도를 다 쓴 기록, 완료된 기록이 빠진다")
    void findRetryable_excludesSupersededAndExhausted() {
        // given
        WorkflowIntegration original = failed(0);
        original.markSuperseded();
        WorkflowIntegration latest = failed(1);
        WorkflowIntegration exhausted = failed(3);
        WorkflowIntegration completed = integration(0);
        completed.markCompleted("env-1", Map.of("status", "sent"));
        integrationRepository.saveAll(List.of(original, latest, exhausted, completed));

        // when
        List<WorkflowIntegration> retryable = integrationRepository.findRetryable();

        // then
        assertThat(retryable).extracting(WorkflowIntegration::getId).containsExactly(latest.getId());
    }

    @Test
    @DisplayName("잠금 조회로 읽은 기록의 superseded 표시는 저장 후 다시 읽어도 유지된다")
    void findByIdForUpdate_seesSupersededFlag() {
        WorkflowIntegration original = integrationRepository.saveAndFlush(failed(0));

        WorkflowIntegration locked = integrationRepository.findByIdForUpdate(original.getId()).orElseThrow();
        locked.markSuperseded();
        integrationRepository.saveAndFlush(locked);

        assertThat(integrationRepository.findByIdForUpdate(original.getId()))
                .get()
                .satisfies(found -> {
                    assertThat(found.isSuperseded()).isTrue();
                    assertThat(found.isRetryable()).isFalse();
                });
    }

    private WorkflowIntegration failed(int retryCount) {
        WorkflowIntegration integration = integration(retryCount);
        integration.markFailed("docusign circuit breaker is open");
        return integration;
    }

    private WorkflowIntegration integration(int retryCount) {
        return WorkflowIntegration.builder()
                .workflowId(workflowId)
                .stepId(stepId)
                .integrationType(IntegrationType.DOCUSIGN)
                .requestPayload(Map.of("document_type", "offer-letter"))
                .maxRetries(3)
                .retryCount(retryCount)
                .build();
    }
}
