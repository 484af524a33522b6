package com.hubhrms.onboarding.service;

import com.hubhrms.common.exception.BusinessException;
import com.hubhrms.common.exception.ErrorCode;
import com.hubhrms.onboarding.entity.ExceptionType;
import com.hubhrms.onboarding.entity.OnboardingStage;
import com.hubhrms.onboarding.entity.ResolutionStatus;
import com.hubhrms.onboarding.entity.Severity;
import com.hubhrms.onboarding.entity.StepType;
import com.hubhrms.onboarding.entity.WorkflowException;
import com.hubhrms.onboarding.entity.WorkflowStep;
import com.hubhrms.onboarding.repository.OnboardingWorkflowRepository;
import com.hubhrms.onboarding.repository.WorkflowExceptionRepository;
import com.hubhrms.onboarding.repository.WorkflowStepRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkflowExceptionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-04T09:00:00Z"), ZoneOffset.UTC);

    @Mock private WorkflowExceptionRepository exceptionRepository;
    @Mock private OnboardingWorkflowRepository workflowRepository;
    @Mock private WorkflowStepRepository stepRepository;

    private WorkflowExceptionService service;
    private final UUID workflowId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new WorkflowExceptionService(exceptionRepository, workflowRepository, stepRepository, CLOCK);
    }

    @Test
    @DisplayName("예외는 항상 OPEN 으로 생성된다")
    void raise_open() {
        when(workflowRepository.existsById(workflowId)).thenReturn(true);
        when(exceptionRepository.save(any(WorkflowException.class))).thenAnswer(invocation -> invocation.getArgument(0));

        WorkflowException exception = service.raiseException(workflowId, new ExceptionDraft(
                null, ExceptionType.DATA_MISSING, Severity.MEDIUM, "I-9 서류 누락", null, null));

        assertThat(exception.getResolutionStatus()).isEqualTo(ResolutionStatus.OPEN);
        assertThat(exception.getWorkflowId()).isEqualTo(workflowId);
        assertThat(exception.getStepId()).isNull();
    }

    @Test
    @DisplayName("다른 워크플로우의 단계를 참조하면 INVALID_INPUT")
    void raise_foreignStep() {
        WorkflowStep foreign = WorkflowStep.builder()
                .workflowId(UUID.randomUUID())
                .stepOrder(1)
                .stepName("offer")
                .stepType(StepType.MANUAL)
                .stage(OnboardingStage.PRE_BOARDING)
                .build();
        when(workflowRepository.existsById(workflowId)).thenReturn(true);
        when(stepRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> service.raiseException(workflowId,
                ExceptionDraft.integrationFailure(foreign.getId(), "docusign", "down")))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));
        verify(exceptionRepository, never()).save(any());
    }

    @Test
    @DisplayName("없는 워크플로우에 예외를 만들 수 없다")
    void raise_unknownWorkflow() {
        when(workflowRepository.existsById(workflowId)).thenReturn(false);

        assertThatThrownBy(() -> service.raiseException(workflowId,
                new ExceptionDraft(null, ExceptionType.OTHER, Severity.LOW, "title", null, null)))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.WORKFLOW_NOT_FOUND));
    }

    @Test
    @DisplayName("해결은 첫 번째 요청만 반영되고 두 번째 요청은 기존 해결 정보를 그대로 돌려준다")
    void resolve_firstWriterWins() {
        WorkflowException exception = WorkflowException.builder()
                .workflowId(workflowId)
                .exceptionType(ExceptionType.INTEGRATION_FAILURE)
                .severity(Severity.HIGH)
                .title("docusign integration failed")
                .build();
        when(exceptionRepository.findByIdForUpdate(exception.getId())).thenReturn(Optional.of(exception));
        UUID firstResolver = UUID.randomUUID();
        UUID secondResolver = UUID.randomUUID();

        service.resolveException(exception.getId(), firstResolver, "재발송 완료");
        WorkflowException second = service.resolveException(exception.getId(), secondResolver, "다시 처리");

        assertThat(second.getResolutionStatus()).isEqualTo(ResolutionStatus.RESOLVED);
        assertThat(second.getResolvedBy()).isEqualTo(firstResolver);
        assertThat(second.getResolutionNotes()).isEqualTo("재발송 완료");
        assertThat(second.getResolvedAt()).isEqualTo(LocalDateTime.now(CLOCK));
    }

    @Test
    @DisplayName("없는 예외 해결은 EXCEPTION_NOT_FOUND")
    void resolve_unknown() {
        UUID exceptionId = UUID.randomUUID();
        when(exceptionRepository.findByIdForUpdate(exceptionId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.resolveException(exceptionId, UUID.randomUUID(), null))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.EXCEPTION_NOT_FOUND));
    }
}
