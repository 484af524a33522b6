package com.hubhrms.onboarding.gateway;

/**
 * 전자서명(DocuSign) 추상화 인터페이스
 *
 * 실패는 {@link DocuSignEnvelopeResult#failure(String)} 로 돌려주거나 예외로 던질 수 있다.
 * 호출 측은 두 경우를 모두 연동 실패로 기록한다.
 */
public interface DocuSignGateway {

    /**
     * 서명 요청 봉투 발송
     */
    DocuSignEnvelopeResult sendEnvelope(DocuSignEnvelopeRequest request);
}
