package com.hubhrms.onboarding.client;

import com.hubhrms.common.dto.ApiResponse;
import com.hubhrms.common.exception.BusinessException;
import com.hubhrms.common.exception.ErrorCode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.util.Optional;
import java.util.UUID;

/**
 * 직원 서비스 클라이언트
 *
 * Resilience4j 적용:
 * - @CircuitBreaker: 직원 서비스 장애 시 빠른 실패
 * - @Retry: 일시적 네트워크 오류 시 재시도 (조회라서 멱등)
 *
 * 404 는 장애가 아니라 "직원 없음"이므로 empty 로 돌려주고 서킷 집계에 넣지 않는다.
 */
@Slf4j
@Component
public class EmployeeServiceClient implements EmployeeDirectory {

    private static final String RESILIENCE_NAME = "employeeService";

    private final RestClient restClient;

    public EmployeeServiceClient(@Qualifier("employeeRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    @CircuitBreaker(name = RESILIENCE_NAME, fallbackMethod = "findByIdFallback")
    @Retry(name = RESILIENCE_NAME)
    public Optional<EmployeeProfile> findById(UUID employeeId) {
        log.debug("[Resilience4j] 직원 조회 시도: employeeId={}", employeeId);
        try {
            ApiResponse<EmployeeProfile> response = restClient.get()
                    .uri("/{employeeId}", employeeId)
                    .retrieve()
                    .body(new ParameterizedTypeReference<>() {});

            if (response == null || response.getData() == null) {
                return Optional.empty();
            }
            return Optional.of(response.getData());
        } catch (HttpClientErrorException.NotFound e) {
            log.warn("직원 없음: employeeId={}", employeeId);
            return Optional.empty();
        }
    }

    /**
     * 서킷 OPEN 또는 모든 재시도 실패 시 호출
     */
    private Optional<EmployeeProfile> findByIdFallback(UUID employeeId, Exception ex) {
        log.error("[Fallback] 직원 조회 실패 - employeeId={}, 원인: {}", employeeId, ex.getMessage());
        throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, "employee service", ex);
    }
}
