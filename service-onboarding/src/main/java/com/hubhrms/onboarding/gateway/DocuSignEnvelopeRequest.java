package com.hubhrms.onboarding.gateway;

import java.util.UUID;

public record DocuSignEnvelopeRequest(
        String documentType,
        String signerEmail,
        String signerName,
        UUID employeeId
) {
}
