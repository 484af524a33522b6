package com.hubhrms.onboarding.repository;

import com.hubhrms.onboarding.entity.WorkflowStep;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowStepRepository extends JpaRepository<WorkflowStep, UUID> {

    List<WorkflowStep> findByWorkflowIdOrderByStepOrderAsc(UUID workflowId);

    /**
     * 단계 엔티티를 영속성 컨텍스트에 올리지 않고 소속 워크플로우 ID 만 조회
     * (워크플로우 잠금 후에 단계를 읽기 위해)
     */
    @Query("SELECT s.workflowId FROM WorkflowStep s WHERE s.id = :stepId")
    Optional<UUID> findWorkflowIdByStepId(@Param("stepId") UUID stepId);
}
