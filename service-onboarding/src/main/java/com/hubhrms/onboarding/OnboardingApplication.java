package com.hubhrms.onboarding;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {
        "com.hubhrms.onboarding",
        "com.hubhrms.common"  // GlobalExceptionHandler, 멱등성 Aspect 스캔
})
public class OnboardingApplication {
    public static void main(String[] args) {
        SpringApplication.run(OnboardingApplication.class, args);
    }
}
