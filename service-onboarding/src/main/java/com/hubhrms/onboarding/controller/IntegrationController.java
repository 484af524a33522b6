package com.hubhrms.onboarding.controller;

import com.hubhrms.common.dto.ApiResponse;
import com.hubhrms.common.idempotency.Idempotent;
import com.hubhrms.onboarding.dto.IntegrationResponse;
import com.hubhrms.onboarding.service.IntegrationTriggerService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/onboarding/integrations")
@RequiredArgsConstructor
public class IntegrationController {

    private final IntegrationTriggerService triggerService;

    /**
     * 실패한 연동 운영자 재시도 (한도 초과 시 409 RETRY_LIMIT_EXCEEDED)
     */
    @PostMapping("/{integrationId}/retry")
    @Idempotent(prefix = "onboarding-integration-retry")
    public ResponseEntity<ApiResponse<IntegrationResponse>> retryIntegration(@PathVariable UUID integrationId) {
        return ResponseEntity.ok(ApiResponse.success(
                IntegrationResponse.from(triggerService.retryIntegration(integrationId))));
    }

    /**
     * 재시도 가능한 실패 연동 목록
     */
    @GetMapping("/retryable")
    public ApiResponse<List<IntegrationResponse>> listRetryable() {
        return ApiResponse.success(triggerService.listRetryableIntegrations().stream()
                .map(IntegrationResponse::from)
                .toList());
    }
}
