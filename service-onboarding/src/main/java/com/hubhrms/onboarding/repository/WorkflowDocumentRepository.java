package com.hubhrms.onboarding.repository;

import com.hubhrms.onboarding.entity.WorkflowDocument;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface WorkflowDocumentRepository extends JpaRepository<WorkflowDocument, UUID> {

    List<WorkflowDocument> findByWorkflowIdOrderByCreatedAtAsc(UUID workflowId);
}
