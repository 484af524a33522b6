package com.hubhrms.onboarding.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 외부 연동 유형
 * value 는 Resilience4j 인스턴스 이름과 로그/예외 제목에 그대로 쓰인다.
 */
@Getter
@RequiredArgsConstructor
public enum IntegrationType {
    DOCUSIGN("docusign"),
    BACKGROUND_CHECK("background-check"),
    DOC_SEARCH("doc-search");

    @JsonValue
    private final String value;
}
