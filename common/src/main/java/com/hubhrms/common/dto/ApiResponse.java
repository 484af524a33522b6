package com.hubhrms.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.hubhrms.common.logging.RequestIdFilter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.slf4j.MDC;

/**
 * 공통 API 응답 래퍼
 *
 * <p>실패 응답에는 요청의 traceId 를 함께 실어 운영자가 로그를 바로 찾을 수 있게 한다.</p>
 */
@Builder
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;
    private T data;
    private ErrorInfo errorInfo;
    private String traceId;

    public static <T> ApiResponse<T> success() {
        return ApiResponse.<T>builder()
                .success(true)
                .build();
    }

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> fail(String code, String message) {
        return fail(ErrorInfo.of(code, message));
    }

    public static <T> ApiResponse<T> fail(ErrorInfo errorInfo) {
        return ApiResponse.<T>builder()
                .success(false)
                .errorInfo(errorInfo)
                .traceId(MDC.get(RequestIdFilter.MDC_TRACE_ID))
                .build();
    }
}
