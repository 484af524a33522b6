package com.hubhrms.onboarding.gateway;

import com.hubhrms.onboarding.config.OnboardingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 연동 제공자 조회 테이블
 *
 * 주입된 gateway 빈으로 생성 시점에 한 번 구성되며 이후 변경되지 않는다.
 * 신원조회 제공자는 onboarding.background-check.provider 로 선택한다.
 */
@Slf4j
@Component
public class IntegrationGatewayRegistry {

    private final DocuSignGateway docuSignGateway;
    private final DocSearchGateway docSearchGateway;
    private final Map<String, BackgroundCheckGateway> backgroundCheckProviders;
    private final BackgroundCheckGateway activeBackgroundCheck;

    public IntegrationGatewayRegistry(DocuSignGateway docuSignGateway,
                                      DocSearchGateway docSearchGateway,
                                      List<BackgroundCheckGateway> backgroundCheckGateways,
                                      OnboardingProperties properties) {
        this.docuSignGateway = docuSignGateway;
        this.docSearchGateway = docSearchGateway;
        this.backgroundCheckProviders = backgroundCheckGateways.stream()
                .collect(Collectors.toUnmodifiableMap(BackgroundCheckGateway::providerName, Function.identity()));

        String provider = properties.getBackgroundCheck().getProvider();
        this.activeBackgroundCheck = backgroundCheckProviders.get(provider);
        if (activeBackgroundCheck == null) {
            throw new IllegalStateException("등록되지 않은 신원조회 제공자: " + provider
                    + " (available: " + backgroundCheckProviders.keySet() + ")");
        }
        log.info("연동 제공자 구성 완료: backgroundCheckProvider={}, available={}",
                provider, backgroundCheckProviders.keySet());
    }

    public DocuSignGateway docuSign() {
        return docuSignGateway;
    }

    public DocSearchGateway docSearch() {
        return docSearchGateway;
    }

    public BackgroundCheckGateway backgroundCheck() {
        return activeBackgroundCheck;
    }
}
