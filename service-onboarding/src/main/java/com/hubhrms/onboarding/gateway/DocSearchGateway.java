package com.hubhrms.onboarding.gateway;

/**
 * 문서 저장소 검색 추상화 인터페이스
 */
public interface DocSearchGateway {

    DocSearchResult searchDocuments(DocSearchRequest request);
}
