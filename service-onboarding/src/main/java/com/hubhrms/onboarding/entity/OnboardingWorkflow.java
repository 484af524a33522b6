package com.hubhrms.onboarding.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "onboarding_workflows", indexes = {
        @Index(name = "idx_workflow_employee", columnList = "employee_id"),
        @Index(name = "idx_workflow_status", columnList = "status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OnboardingWorkflow {

    @Id
    private UUID id;

    @Column(name = "employee_id", nullable = false)
    private UUID employeeId;

    @Column(name = "employee_name", length = 200)
    private String employeeName;

    @Column(name = "employee_email", length = 200)
    private String employeeEmail;

    @Column(name = "template_name", nullable = false, length = 100)
    private String templateName;

    @Column(name = "template_id")
    private UUID templateId;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private WorkflowStatus status;

    @Column(name = "current_stage", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OnboardingStage currentStage;

    @Column(name = "overall_progress", nullable = false)
    private int overallProgress;

    @Column(name = "start_date", nullable = false)
    private LocalDateTime startDate;

    @Column(name = "expected_completion_date")
    private LocalDateTime expectedCompletionDate;

    @Column(name = "actual_completion_date")
    private LocalDateTime actualCompletionDate;

    @Column(name = "created_by")
    private UUID createdBy;

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
    public OnboardingWorkflow(UUID employeeId, String employeeName, String employeeEmail,
                              String templateName, UUID templateId, UUID createdBy,
                              LocalDateTime startDate, LocalDateTime expectedCompletionDate) {
        this.id = UUID.randomUUID();
        this.employeeId = employeeId;
        this.employeeName = employeeName;
        this.employeeEmail = employeeEmail;
        this.templateName = templateName;
        this.templateId = templateId;
        this.createdBy = createdBy;
        this.startDate = startDate;
        this.expectedCompletionDate = expectedCompletionDate;
        this.status = WorkflowStatus.IN_PROGRESS;
        this.currentStage = OnboardingStage.PRE_BOARDING;
        this.overallProgress = OnboardingStage.PRE_BOARDING.getProgress();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * 다음 단계로 진입
     * - progress 는 진입한 단계의 체크포인트로 올라가며 절대 내려가지 않는다
     * - completed 진입 시 워크플로우 상태도 COMPLETED 로 바뀌고 실제 완료일이 찍힌다
     */
    public void advanceTo(OnboardingStage stage, LocalDateTime now) {
        if (isTerminal()) {
            throw new IllegalStateException("종료된 워크플로우는 단계를 진행할 수 없습니다: " + status);
        }
        this.currentStage = stage;
        this.overallProgress = Math.max(this.overallProgress, stage.getProgress());
        if (stage.isFinal()) {
            this.status = WorkflowStatus.COMPLETED;
            this.actualCompletionDate = now;
        }
    }

    /**
     * 워크플로우 취소 (되돌릴 수 없음, 단계는 건드리지 않는다)
     */
    public void cancel() {
        if (isTerminal()) {
            throw new IllegalStateException("이미 종료된 워크플로우입니다: " + status);
        }
        this.status = WorkflowStatus.CANCELLED;
    }
}
