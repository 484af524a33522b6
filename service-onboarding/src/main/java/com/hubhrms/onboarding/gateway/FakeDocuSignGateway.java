package com.hubhrms.onboarding.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 테스트용 Fake 전자서명 구현체
 *
 * 설정 가능:
 * - onboarding.gateway.docusign.delay-ms: 처리 지연 시간 (기본 500ms)
 * - onboarding.gateway.docusign.failure-rate: 실패 확률 0.0~1.0 (기본 0.0)
 */
@Slf4j
@Component
public class FakeDocuSignGateway extends SimulatedGateway implements DocuSignGateway {

    private final Clock clock;

    public FakeDocuSignGateway(@Value("${onboarding.gateway.docusign.delay-ms:500}") long delayMs,
                               @Value("${onboarding.gateway.docusign.failure-rate:0.0}") double failureRate,
                               Clock clock) {
        super(delayMs, failureRate);
        this.clock = clock;
    }

    @Override
    public DocuSignEnvelopeResult sendEnvelope(DocuSignEnvelopeRequest request) {
        log.info("[Fake DocuSign] 서명 요청 발송 - documentType: {}, signer: {}",
                request.documentType(), request.signerEmail());

        simulateDelay();

        if (shouldFail()) {
            log.warn("[Fake DocuSign] 발송 실패 (시뮬레이션)");
            return DocuSignEnvelopeResult.failure(SIMULATED_FAILURE);
        }

        String envelopeId = generateId("mock-env-");
        log.info("[Fake DocuSign] 발송 완료 - envelopeId: {}", envelopeId);
        return DocuSignEnvelopeResult.sent(envelopeId, request.signerEmail(), LocalDateTime.now(clock));
    }
}
