package com.hubhrms.onboarding.repository;

import com.hubhrms.onboarding.entity.ResolutionStatus;
import com.hubhrms.onboarding.entity.WorkflowException;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowExceptionRepository extends JpaRepository<WorkflowException, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM WorkflowException e WHERE e.id = :id")
    Optional<WorkflowException> findByIdForUpdate(@Param("id") UUID id);

    List<WorkflowException> findByWorkflowIdOrderByCreatedAtDesc(UUID workflowId);

    List<WorkflowException> findByResolutionStatusNotOrderByCreatedAtDesc(ResolutionStatus status);

    long countByWorkflowIdAndResolutionStatusNot(UUID workflowId, ResolutionStatus status);

    long countByResolutionStatusNot(ResolutionStatus status);
}
