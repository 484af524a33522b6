package com.hubhrms.onboarding.gateway;

import java.time.LocalDateTime;

/**
 * 전자서명 응답 결과
 */
public record DocuSignEnvelopeResult(
        boolean success,
        String envelopeId,
        String status,
        LocalDateTime sentAt,
        String signerEmail,
        String errorMessage
) {
    public static DocuSignEnvelopeResult sent(String envelopeId, String signerEmail, LocalDateTime sentAt) {
        return new DocuSignEnvelopeResult(true, envelopeId, "sent", sentAt, signerEmail, null);
    }

    public static DocuSignEnvelopeResult failure(String errorMessage) {
        return new DocuSignEnvelopeResult(false, null, null, null, null, errorMessage);
    }
}
