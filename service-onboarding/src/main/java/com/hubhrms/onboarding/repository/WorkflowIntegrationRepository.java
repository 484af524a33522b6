package com.hubhrms.onboarding.repository;

import com.hubhrms.onboarding.entity.WorkflowIntegration;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowIntegrationRepository extends JpaRepository<WorkflowIntegration, UUID> {

    List<WorkflowIntegration> findByWorkflowIdOrderByCreatedAtAsc(UUID workflowId);

    List<WorkflowIntegration> findByStepIdOrderByCreatedAtAsc(UUID stepId);

    /**
     * 재시도 선점용 - 같은 기록의 동시 재시도를 한 건으로 직렬화
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM WorkflowIntegration i WHERE i.id = :id")
    Optional<WorkflowIntegration> findByIdForUpdate(@Param("id") UUID id);

    /**
     * 운영자 재시도 대상: 실패했고, 아직 재시도되지 않았고, 재시도 한도가 남은 기록
     */
    @Query("SELECT i FROM WorkflowIntegration i " +
            "WHERE i.status = com.hubhrms.onboarding.entity.IntegrationStatus.FAILED " +
            "AND i.superseded = false " +
            "AND i.retryCount < i.maxRetries ORDER BY i.createdAt ASC")
    List<WorkflowIntegration> findRetryable();
}
