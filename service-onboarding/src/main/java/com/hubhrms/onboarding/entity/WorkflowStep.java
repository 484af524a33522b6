package com.hubhrms.onboarding.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "workflow_steps", indexes = {
        @Index(name = "idx_step_workflow", columnList = "workflow_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WorkflowStep {

    @Id
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(name = "step_order", nullable = false)
    private int stepOrder;

    @Column(name = "step_name", nullable = false, length = 200)
    private String stepName;

    @Column(length = 500)
    private String description;

    @Column(name = "step_type", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private StepType stepType;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OnboardingStage stage;

    @Column(name = "integration_type", length = 30)
    @Enumerated(EnumType.STRING)
    private IntegrationType integrationType;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "integration_config", length = 2000)
    private Map<String, Object> integrationConfig = new LinkedHashMap<>();

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private StepStatus status;

    /**
     * 선행 단계 ID (템플릿 생성 시 한 번 정해지고 이후 바뀌지 않는다)
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "workflow_step_dependencies", joinColumns = @JoinColumn(name = "step_id"))
    @OrderColumn(name = "dependency_order")
    @Column(name = "depends_on_step_id", nullable = false)
    private List<UUID> dependencies = new ArrayList<>();

    @Column(name = "due_date")
    private LocalDateTime dueDate;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "completed_by")
    private UUID completedBy;

    @Column(name = "skipped_at")
    private LocalDateTime skippedAt;

    @Column(name = "skipped_by")
    private UUID skippedBy;

    @Column(name = "skip_reason", length = 500)
    private String skipReason;

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
    public WorkflowStep(UUID id, UUID workflowId, int stepOrder, String stepName, String description,
                        StepType stepType, OnboardingStage stage, IntegrationType integrationType,
                        Map<String, Object> integrationConfig, StepStatus status,
                        List<UUID> dependencies, LocalDateTime dueDate) {
        this.id = id != null ? id : UUID.randomUUID();
        this.workflowId = workflowId;
        this.stepOrder = stepOrder;
        this.stepName = stepName;
        this.description = description;
        this.stepType = stepType;
        this.stage = stage;
        this.integrationType = integrationType;
        if (integrationConfig != null) {
            this.integrationConfig = new LinkedHashMap<>(integrationConfig);
        }
        this.status = status != null ? status : StepStatus.BLOCKED;
        if (dependencies != null) {
            this.dependencies = new ArrayList<>(dependencies);
        }
        this.dueDate = dueDate;
    }

    public boolean isDone() {
        return status.isDone();
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    /**
     * 단계 시작. 이미 진행 중이면 최초 시작 시각을 유지한다.
     */
    public void start(LocalDateTime now) {
        if (isDone()) {
            throw new IllegalStateException("이미 끝난 단계는 시작할 수 없습니다: " + status);
        }
        if (this.status == StepStatus.IN_PROGRESS) {
            return;
        }
        this.status = StepStatus.IN_PROGRESS;
        this.startedAt = now;
    }

    public void complete(UUID completedBy, LocalDateTime now) {
        if (isDone()) {
            throw new IllegalStateException("이미 끝난 단계입니다: " + status);
        }
        this.status = StepStatus.COMPLETED;
        this.completedBy = completedBy;
        this.completedAt = now;
    }

    public void skip(UUID skippedBy, String reason, LocalDateTime now) {
        if (isDone()) {
            throw new IllegalStateException("이미 끝난 단계입니다: " + status);
        }
        this.status = StepStatus.SKIPPED;
        this.skippedBy = skippedBy;
        this.skipReason = reason;
        this.skippedAt = now;
    }

    /**
     * 단계 진입 시 대기 해제 (BLOCKED → PENDING). 다른 상태는 그대로 둔다.
     */
    public boolean unblock() {
        if (this.status != StepStatus.BLOCKED) {
            return false;
        }
        this.status = StepStatus.PENDING;
        return true;
    }

    public String configValue(String key) {
        Object value = integrationConfig.get(key);
        return value == null ? null : value.toString();
    }
}
