package com.hubhrms.common.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 요청별 traceId / workflowId 를 MDC에 설정하는 필터
 *
 * 동작:
 * 1. X-Request-ID 헤더가 있으면 → 해당 값 사용 (호출 측에서 전파)
 * 2. 없으면 → 새로 생성
 * 3. URI 가 /workflows/{uuid} 형태면 workflowId 를 MDC 에 추가
 *
 * MDC 키:
 * - traceId: 요청 추적 ID
 * - workflowId: 온보딩 워크플로우 ID (경로에 있을 때만)
 */
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String MDC_TRACE_ID = "traceId";
    public static final String MDC_WORKFLOW_ID = "workflowId";

    private static final Pattern WORKFLOW_PATH =
            Pattern.compile("/workflows/([0-9a-fA-F\\-]{36})");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        try {
            String traceId = request.getHeader(REQUEST_ID_HEADER);
            if (traceId == null || traceId.isBlank()) {
                traceId = generateTraceId();
            }
            MDC.put(MDC_TRACE_ID, traceId);

            Matcher matcher = WORKFLOW_PATH.matcher(request.getRequestURI());
            if (matcher.find()) {
                MDC.put(MDC_WORKFLOW_ID, matcher.group(1));
            }

            response.setHeader(REQUEST_ID_HEADER, traceId);

            filterChain.doFilter(request, response);
        } finally {
            // 스레드 재사용 시 이전 요청 값이 남지 않도록
            MDC.clear();
        }
    }

    private String generateTraceId() {
        return "REQ-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}
