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
 * 외부 연동 호출 1회의 감사/상태 기록
 *
 * 재시도는 기존 기록을 되살리지 않고 retryCount 를 1 올린 새 기록을 만든다.
 * 재시도된 기록은 superseded 로 표시되어 다시 재시도 대상이 되지 않는다.
 */
@Entity
@Table(name = "workflow_integrations", indexes = {
        @Index(name = "idx_integration_workflow", columnList = "workflow_id"),
        @Index(name = "idx_integration_status", columnList = "status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WorkflowIntegration {

    public static final int DEFAULT_MAX_RETRIES = 3;

    @Id
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(name = "step_id", nullable = false)
    private UUID stepId;

    @Column(name = "integration_type", nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    private IntegrationType integrationType;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private IntegrationStatus status;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "request_payload", length = 4000)
    private Map<String, Object> requestPayload = new LinkedHashMap<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "response_payload", length = 8000)
    private Map<String, Object> responsePayload = new LinkedHashMap<>();

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "external_id", length = 100)
    private String externalId;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(nullable = false)
    private boolean superseded;

    @Column(name = "last_attempt_at")
    private LocalDateTime lastAttemptAt;

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
        if (this.status == null) {
            this.status = IntegrationStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    @Builder
    public WorkflowIntegration(UUID workflowId, UUID stepId, IntegrationType integrationType,
                               Map<String, Object> requestPayload, Integer maxRetries, int retryCount,
                               LocalDateTime lastAttemptAt) {
        this.id = UUID.randomUUID();
        this.workflowId = workflowId;
        this.stepId = stepId;
        this.integrationType = integrationType;
        if (requestPayload != null) {
            this.requestPayload = new LinkedHashMap<>(requestPayload);
        }
        this.maxRetries = maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES;
        this.retryCount = retryCount;
        this.lastAttemptAt = lastAttemptAt;
        this.status = IntegrationStatus.PENDING;
    }

    /**
     * 호출 성공 - 한 번 저장된 응답은 이후 지워지지 않는다
     */
    public void markCompleted(String externalId, Map<String, Object> response) {
        if (this.status == IntegrationStatus.COMPLETED) {
            throw new IllegalStateException("이미 완료된 연동 기록입니다: " + id);
        }
        this.status = IntegrationStatus.COMPLETED;
        this.externalId = externalId;
        this.responsePayload = response != null ? new LinkedHashMap<>(response) : new LinkedHashMap<>();
        this.errorMessage = null;
    }

    /**
     * 호출 실패 - 실패 기록은 항상 비어있지 않은 오류 메시지를 가진다
     */
    public void markFailed(String error) {
        if (this.status == IntegrationStatus.COMPLETED) {
            throw new IllegalStateException("완료된 연동 기록은 실패로 바꿀 수 없습니다: " + id);
        }
        this.status = IntegrationStatus.FAILED;
        this.errorMessage = (error == null || error.isBlank())
                ? integrationType.getValue() + " request failed without error message"
                : error;
    }

    /**
     * 재시도로 새 기록이 만들어졌다는 표시 - 한 기록에서 재시도는 한 번만 나간다
     */
    public void markSuperseded() {
        if (this.status != IntegrationStatus.FAILED || this.superseded) {
            throw new IllegalStateException("재시도할 수 없는 연동 기록입니다: " + id + ", status=" + status
                    + ", superseded=" + superseded);
        }
        this.superseded = true;
    }

    /**
     * 운영자 재시도 대상인지 (실패 + 아직 재시도되지 않음 + 재시도 한도 미만)
     */
    public boolean isRetryable() {
        return status == IntegrationStatus.FAILED && !superseded && retryCount < maxRetries;
    }
}
