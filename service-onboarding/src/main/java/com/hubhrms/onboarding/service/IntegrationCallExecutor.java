package com.hubhrms.onboarding.service;

import com.hubhrms.onboarding.entity.IntegrationType;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 외부 연동 호출 실행기
 *
 * <pre>
 * CircuitBreaker → TimeLimiter → 전용 스레드 풀에서 gateway 호출
 * </pre>
 *
 * 인스턴스 이름은 연동 유형 값(docusign, background-check, doc-search)이며 application.yml 에서 조정한다.
 * 재시도는 하지 않는다. 실패한 호출은 연동 기록으로 남기고 운영자가 다시 시도한다.
 */
@Slf4j
@Component
public class IntegrationCallExecutor {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final ExecutorService executor;

    public IntegrationCallExecutor(CircuitBreakerRegistry circuitBreakerRegistry,
                                   TimeLimiterRegistry timeLimiterRegistry,
                                   @Qualifier("integrationExecutor") ExecutorService executor) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.executor = executor;
    }

    /**
     * @throws IntegrationCallException 호출이 예외로 끝났거나 시간 초과, 서킷 OPEN 인 경우
     */
    public <T> T execute(IntegrationType type, Supplier<T> call) {
        String name = type.getValue();
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(name);
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(name);

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Callable<T> limited = TimeLimiter.decorateFutureSupplier(timeLimiter,
                () -> executor.submit(() -> callWithMdc(mdc, call)));
        Callable<T> guarded = CircuitBreaker.decorateCallable(circuitBreaker, limited);

        try {
            return guarded.call();
        } catch (TimeoutException e) {
            long timeoutMs = timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis();
            String message = name + " request timed out after " + timeoutMs + "ms";
            log.error("[Integration] 호출 시간 초과: type={}, timeoutMs={}", name, timeoutMs);
            throw new IntegrationCallException(message, true, e);
        } catch (CallNotPermittedException e) {
            log.error("[Integration] 서킷 OPEN, 호출 차단: type={}", name);
            throw new IntegrationCallException(name + " circuit breaker is open", false, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IntegrationCallException(name + " request interrupted", false, e);
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[Integration] 호출 실패: type={}, error={}", name, message);
            throw new IntegrationCallException(message, false, e);
        }
    }

    private <T> T callWithMdc(Map<String, String> mdc, Supplier<T> call) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            return call.get();
        } finally {
            MDC.clear();
        }
    }
}
