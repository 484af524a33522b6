package com.hubhrms.onboarding.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 테스트용 Fake 신원조회 제공자 (provider: mock)
 *
 * 설정 가능:
 * - onboarding.gateway.background-check.delay-ms (기본 800ms)
 * - onboarding.gateway.background-check.failure-rate (기본 0.0)
 */
@Slf4j
@Component
public class FakeBackgroundCheckGateway extends SimulatedGateway implements BackgroundCheckGateway {

    public static final String PROVIDER_NAME = "mock";

    private final Clock clock;

    public FakeBackgroundCheckGateway(@Value("${onboarding.gateway.background-check.delay-ms:800}") long delayMs,
                                      @Value("${onboarding.gateway.background-check.failure-rate:0.0}") double failureRate,
                                      Clock clock) {
        super(delayMs, failureRate);
        this.clock = clock;
    }

    @Override
    public String providerName() {
        return PROVIDER_NAME;
    }

    @Override
    public BackgroundCheckResult initiateCheck(BackgroundCheckRequest request) {
        log.info("[Fake BackgroundCheck] 조회 요청 - email: {}, checkTypes: {}",
                request.email(), request.checkTypes());

        simulateDelay();

        if (shouldFail()) {
            log.warn("[Fake BackgroundCheck] 조회 접수 실패 (시뮬레이션)");
            return BackgroundCheckResult.failure(SIMULATED_FAILURE);
        }

        String checkId = generateId("mock-check-");
        String candidate = request.firstName() + " " + request.lastName();
        log.info("[Fake BackgroundCheck] 조회 접수 완료 - checkId: {}", checkId);
        return BackgroundCheckResult.initiated(checkId, candidate, request.checkTypes(), LocalDateTime.now(clock));
    }
}
