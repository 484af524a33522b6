package com.hubhrms.onboarding.gateway;

import java.util.Map;

public record FoundDocument(
        String name,
        String documentType,   // handbook, policy, form, training
        String storageKey,
        String fileType,
        long fileSize,
        Map<String, Object> metadata
) {
    public FoundDocument {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
