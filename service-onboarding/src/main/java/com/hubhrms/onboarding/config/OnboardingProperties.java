package com.hubhrms.onboarding.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * onboarding.* 설정
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "onboarding")
public class OnboardingProperties {

    /**
     * 시작일로부터 예상 완료일까지 일수
     */
    private int expectedCompletionDays = 30;

    private final Integration integration = new Integration();
    private final DocSearch docSearch = new DocSearch();
    private final BackgroundCheck backgroundCheck = new BackgroundCheck();
    private final EmployeeService employeeService = new EmployeeService();

    @Getter
    @Setter
    public static class Integration {
        /**
         * 연동 기록에 남기는 재시도 한도 (운영자 재시도 정책)
         */
        private int maxRetries = 3;

        /**
         * 외부 연동 호출 전용 스레드 수 (TimeLimiter 가 이 풀에서 호출을 기다린다)
         */
        private int executorPoolSize = 8;
    }

    @Getter
    @Setter
    public static class DocSearch {
        private int limit = 10;
    }

    @Getter
    @Setter
    public static class BackgroundCheck {
        private String provider = "mock";
        private List<String> defaultCheckTypes = List.of("criminal", "employment");
    }

    @Getter
    @Setter
    public static class EmployeeService {
        private String baseUrl = "http://localhost:8081/api/employees";
    }
}
