package com.hubhrms.common.exception;

import com.hubhrms.common.dto.ErrorInfo;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum ErrorCode {
    // ========================================
    // 공통
    // ========================================
    INVALID_INPUT("COMMON_001", "잘못된 입력입니다", HttpStatus.BAD_REQUEST),
    INTERNAL_ERROR("COMMON_002", "내부 서버 오류가 발생했습니다", HttpStatus.INTERNAL_SERVER_ERROR),

    // ========================================
    // 인프라/시스템
    // ========================================
    /** 저장소 쓰기 실패 - 논리적 연산 전체가 롤백됨 */
    PERSISTENCE_ERROR("INFRA_001", "데이터 저장에 실패했습니다", HttpStatus.INTERNAL_SERVER_ERROR),

    /** 외부/내부 서비스 일시 장애 (Fallback) */
    SERVICE_UNAVAILABLE("INFRA_002", "서비스가 일시적으로 불안정합니다. 잠시 후 다시 시도해주세요.",
            HttpStatus.SERVICE_UNAVAILABLE),

    // ========================================
    // 조회 실패 (NotFound)
    // ========================================
    WORKFLOW_NOT_FOUND("ONBOARDING_001", "온보딩 워크플로우를 찾을 수 없습니다", HttpStatus.NOT_FOUND),
    STEP_NOT_FOUND("ONBOARDING_002", "워크플로우 단계를 찾을 수 없습니다", HttpStatus.NOT_FOUND),
    EMPLOYEE_NOT_FOUND("ONBOARDING_003", "직원 정보를 찾을 수 없습니다", HttpStatus.NOT_FOUND),
    INTEGRATION_NOT_FOUND("ONBOARDING_004", "연동 기록을 찾을 수 없습니다", HttpStatus.NOT_FOUND),
    EXCEPTION_NOT_FOUND("ONBOARDING_005", "워크플로우 예외를 찾을 수 없습니다", HttpStatus.NOT_FOUND),

    // ========================================
    // 상태 전이
    // ========================================
    /** 선행 단계가 완료/건너뜀 상태가 아님 - 사용자가 조치해야 하며 자동 재시도 대상 아님 */
    DEPENDENCY_NOT_MET("ONBOARDING_101", "선행 단계가 아직 완료되지 않았습니다", HttpStatus.CONFLICT),

    /** 종료된 워크플로우 취소, completed 이후 단계 진행 등 */
    INVALID_TRANSITION("ONBOARDING_102", "허용되지 않는 상태 전이입니다", HttpStatus.CONFLICT),

    // ========================================
    // 외부 연동
    // ========================================
    INTEGRATION_FAILED("INTEGRATION_001", "외부 연동 호출에 실패했습니다", HttpStatus.BAD_GATEWAY),
    INTEGRATION_TIMEOUT("INTEGRATION_002", "외부 연동 호출 시간이 초과되었습니다", HttpStatus.GATEWAY_TIMEOUT),

    /** max_retries 소진 - 운영자 확인 필요 */
    RETRY_LIMIT_EXCEEDED("INTEGRATION_003", "재시도 한도를 초과했습니다. 관리자 확인이 필요합니다.",
            HttpStatus.CONFLICT),
    ;

    private final String code;
    private final String message;
    private final HttpStatus httpStatus;

    public ErrorInfo toErrorInfo() {
        return ErrorInfo.of(this.code, this.message);
    }

    public ErrorInfo toErrorInfo(String detail) {
        return ErrorInfo.of(this.code, this.message, detail);
    }
}
