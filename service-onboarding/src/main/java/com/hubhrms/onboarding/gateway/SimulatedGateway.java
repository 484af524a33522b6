package com.hubhrms.onboarding.gateway;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Fake 연동 구현체 공통 부분 (지연/실패 시뮬레이션)
 */
abstract class SimulatedGateway {

    static final String SIMULATED_FAILURE = "service unavailable (simulated)";

    private final long delayMs;
    private final double failureRate;

    protected SimulatedGateway(long delayMs, double failureRate) {
        this.delayMs = delayMs;
        this.failureRate = failureRate;
    }

    protected void simulateDelay() {
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                // TimeLimiter 가 타임아웃으로 future 를 취소하면 여기로 온다
                Thread.currentThread().interrupt();
            }
        }
    }

    protected boolean shouldFail() {
        return failureRate > 0 && ThreadLocalRandom.current().nextDouble() < failureRate;
    }

    protected String generateId(String prefix) {
        return prefix + UUID.randomUUID().toString().substring(0, 8);
    }
}
