package com.hubhrms.onboarding.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 사람의 확인이 필요한 상황 (연동 실패, SLA 초과 등)
 * stepId 가 없으면 워크플로우 단위 예외다.
 */
@Entity
@Table(name = "workflow_exceptions", indexes = {
        @Index(name = "idx_exception_workflow", columnList = "workflow_id"),
        @Index(name = "idx_exception_resolution", columnList = "resolution_status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WorkflowException {

    @Id
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(name = "step_id")
    private UUID stepId;

    @Column(name = "exception_type", nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    private ExceptionType exceptionType;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private Severity severity;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 2000)
    private String description;

    @Column(name = "resolution_status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private ResolutionStatus resolutionStatus;

    @Column(name = "assigned_to")
    private UUID assignedTo;

    @Column(name = "resolved_by")
    private UUID resolvedBy;

    @Column(name = "resolution_notes", length = 2000)
    private String resolutionNotes;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Version
    private Long version;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    @Builder
    public WorkflowException(UUID workflowId, UUID stepId, ExceptionType exceptionType, Severity severity,
                             String title, String description, UUID assignedTo) {
        this.id = UUID.randomUUID();
        this.workflowId = workflowId;
        this.stepId = stepId;
        this.exceptionType = exceptionType != null ? exceptionType : ExceptionType.OTHER;
        this.severity = severity != null ? severity : Severity.MEDIUM;
        this.title = title;
        this.description = description;
        this.assignedTo = assignedTo;
        this.resolutionStatus = ResolutionStatus.OPEN;
    }

    public boolean isOpen() {
        return resolutionStatus != ResolutionStatus.RESOLVED;
    }

    /**
     * 예외 해결 (first-writer-wins)
     *
     * @return 이번 호출로 해결 처리되었으면 true, 이미 해결된 예외라 아무것도 바꾸지 않았으면 false
     */
    public boolean resolve(UUID resolvedBy, String notes, LocalDateTime now) {
        if (!isOpen()) {
            return false;
        }
        this.resolutionStatus = ResolutionStatus.RESOLVED;
        this.resolvedBy = resolvedBy;
        this.resolutionNotes = notes;
        this.resolvedAt = now;
        return true;
    }
}
