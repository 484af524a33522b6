package com.hubhrms.onboarding.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@EnableConfigurationProperties(OnboardingProperties.class)
public class OnboardingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * 외부 연동 호출용 스레드 풀 (TimeLimiter 가 요청 스레드에서 결과를 기다린다)
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService integrationExecutor(OnboardingProperties properties) {
        int poolSize = properties.getIntegration().getExecutorPoolSize();
        log.info("연동 호출 스레드 풀 생성: poolSize={}", poolSize);
        return Executors.newFixedThreadPool(poolSize, integrationThreadFactory());
    }

    private ThreadFactory integrationThreadFactory() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "integration-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
