package com.hubhrms.onboarding.repository;

import com.hubhrms.onboarding.entity.OnboardingWorkflow;
import com.hubhrms.onboarding.entity.WorkflowStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface OnboardingWorkflowRepository extends JpaRepository<OnboardingWorkflow, UUID> {

    /**
     * 워크플로우 행 잠금 (SELECT ... FOR UPDATE)
     * 단계 완료 → 단계 진행 판단 → 진행 순서를 워크플로우 단위로 직렬화한다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM OnboardingWorkflow w WHERE w.id = :id")
    Optional<OnboardingWorkflow> findByIdForUpdate(@Param("id") UUID id);

    List<OnboardingWorkflow> findAllByOrderByCreatedAtDesc();

    List<OnboardingWorkflow> findByStatusOrderByCreatedAtDesc(WorkflowStatus status);

    List<OnboardingWorkflow> findByEmployeeIdOrderByCreatedAtDesc(UUID employeeId);

    List<OnboardingWorkflow> findByStatusAndEmployeeIdOrderByCreatedAtDesc(WorkflowStatus status, UUID employeeId);

    long countByStatus(WorkflowStatus status);

    List<OnboardingWorkflow> findByStatusAndActualCompletionDateGreaterThanEqual(
            WorkflowStatus status, LocalDateTime from);
}
