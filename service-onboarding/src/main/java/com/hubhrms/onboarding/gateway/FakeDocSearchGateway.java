package com.hubhrms.onboarding.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 테스트용 Fake 문서 검색 구현체
 * 고정된 문서 목록에서 이름/유형/카테고리로 검색한다. 빈 검색어는 전체 문서를 돌려준다.
 *
 * 설정 가능:
 * - onboarding.gateway.doc-search.delay-ms (기본 200ms)
 * - onboarding.gateway.doc-search.failure-rate (기본 0.0)
 */
@Slf4j
@Component
public class FakeDocSearchGateway extends SimulatedGateway implements DocSearchGateway {

    private static final List<FoundDocument> DOCUMENTS = List.of(
            new FoundDocument("Employee Handbook 2025.pdf", "handbook",
                    "documents/handbooks/employee-handbook-2025.pdf", "pdf", 2_048_576L,
                    Map.of("version", "2025.1", "department", "HR")),
            new FoundDocument("I-9 Employment Eligibility Form.pdf", "form",
                    "documents/forms/i9-form.pdf", "pdf", 524_288L,
                    Map.of("required", true, "category", "onboarding")),
            new FoundDocument("W-4 Tax Withholding Form.pdf", "form",
                    "documents/forms/w4-form.pdf", "pdf", 409_600L,
                    Map.of("required", true, "category", "onboarding")),
            new FoundDocument("Benefits Overview 2025.pdf", "policy",
                    "documents/policies/benefits-overview-2025.pdf", "pdf", 1_048_576L,
                    Map.of("category", "benefits")),
            new FoundDocument("Code of Conduct.pdf", "policy",
                    "documents/policies/code-of-conduct.pdf", "pdf", 716_800L,
                    Map.of("required", true, "category", "compliance")),
            new FoundDocument("Security Awareness Training.pptx", "training",
                    "documents/training/security-awareness.pptx", "pptx", 5_242_880L,
                    Map.of("duration_minutes", 45, "category", "security")),
            new FoundDocument("Engineering Onboarding Guide.docx", "training",
                    "documents/training/engineering-onboarding.docx", "docx", 819_200L,
                    Map.of("department", "Engineering", "category", "onboarding")),
            new FoundDocument("Sales Playbook.pdf", "training",
                    "documents/training/sales-playbook.pdf", "pdf", 3_145_728L,
                    Map.of("department", "Sales", "category", "onboarding")),
            new FoundDocument("Manager Leadership Policy.pdf", "policy",
                    "documents/policies/manager-leadership.pdf", "pdf", 614_400L,
                    Map.of("audience", "managers", "category", "leadership"))
    );

    public FakeDocSearchGateway(@Value("${onboarding.gateway.doc-search.delay-ms:200}") long delayMs,
                                @Value("${onboarding.gateway.doc-search.failure-rate:0.0}") double failureRate) {
        super(delayMs, failureRate);
    }

    @Override
    public DocSearchResult searchDocuments(DocSearchRequest request) {
        log.info("[Fake DocSearch] 문서 검색 - query: {}, limit: {}", request.query(), request.limit());

        simulateDelay();

        if (shouldFail()) {
            log.warn("[Fake DocSearch] 검색 실패 (시뮬레이션)");
            return DocSearchResult.failure(SIMULATED_FAILURE);
        }

        List<FoundDocument> matches = DOCUMENTS.stream()
                .filter(document -> matches(document, request.query()))
                .toList();
        List<FoundDocument> limited = matches.stream()
                .limit(request.limit() > 0 ? request.limit() : matches.size())
                .toList();

        log.info("[Fake DocSearch] 검색 완료 - total: {}, returned: {}", matches.size(), limited.size());
        return DocSearchResult.found(matches.size(), limited);
    }

    private boolean matches(FoundDocument document, String query) {
        if (query == null || query.isBlank()) {
            return true;
        }
        String needle = query.toLowerCase(Locale.ROOT);
        return document.name().toLowerCase(Locale.ROOT).contains(needle)
                || document.documentType().equalsIgnoreCase(needle)
                || document.metadata().values().stream()
                        .anyMatch(value -> value.toString().toLowerCase(Locale.ROOT).contains(needle));
    }
}
