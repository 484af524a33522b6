package com.hubhrms.onboarding.gateway;

/**
 * 신원조회 제공자 추상화 인터페이스
 *
 * 제공자는 여러 개일 수 있으며 {@link IntegrationGatewayRegistry} 가 이름으로 선택한다.
 */
public interface BackgroundCheckGateway {

    /**
     * 제공자 이름 (설정 onboarding.background-check.provider 와 매칭)
     */
    String providerName();

    BackgroundCheckResult initiateCheck(BackgroundCheckRequest request);
}
