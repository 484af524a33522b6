package com.hubhrms.onboarding.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 문서 검색 연동이 찾아낸 문서 (단계에 연결됨)
 */
@Entity
@Table(name = "workflow_documents", indexes = {
        @Index(name = "idx_document_workflow", columnList = "workflow_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WorkflowDocument {

    public static final String STATUS_AVAILABLE = "available";

    @Id
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(name = "step_id")
    private UUID stepId;

    @Column(name = "document_name", nullable = false, length = 300)
    private String documentName;

    @Column(name = "document_type", length = 50)
    private String documentType;

    @Column(name = "storage_key", length = 500)
    private String storageKey;

    @Column(name = "file_type", length = 20)
    private String fileType;

    @Column(name = "file_size")
    private long fileSize;

    @Column(nullable = false, length = 20)
    private String status;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 2000)
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Version
    private Long version;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
    }

    @Builder
    public WorkflowDocument(UUID workflowId, UUID stepId, String documentName, String documentType,
                            String storageKey, String fileType, long fileSize, Map<String, Object> metadata) {
        this.id = UUID.randomUUID();
        this.workflowId = workflowId;
        this.stepId = stepId;
        this.documentName = documentName;
        this.documentType = documentType;
        this.storageKey = storageKey;
        this.fileType = fileType;
        this.fileSize = fileSize;
        this.status = STATUS_AVAILABLE;
        if (metadata != null) {
            this.metadata = new LinkedHashMap<>(metadata);
        }
    }
}
