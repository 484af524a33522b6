package com.hubhrms.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 에러 응답 본문
 *
 * <p>detail 에는 어떤 엔티티/연산에서 실패했는지 (예: {@code stepId=..., operation=startStep})
 * 를 담아 호출자가 로그와 화면에 그대로 노출할 수 있게 한다.</p>
 */
@Builder
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorInfo {

    private String code;
    private String message;
    private String detail;

    public static ErrorInfo of(String code, String message) {
        return of(code, message, null);
    }

    public static ErrorInfo of(String code, String message, String detail) {
        return ErrorInfo.builder()
                .code(code)
                .message(message)
                .detail(detail)
                .build();
    }
}
