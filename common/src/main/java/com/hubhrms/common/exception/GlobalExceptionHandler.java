package com.hubhrms.common.exception;

import com.hubhrms.common.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * 전역 예외 처리기
 *
 * <h2>예외 분류</h2>
 * <pre>
 * - BusinessException: ErrorCode 에 정의된 상태 코드
 *     NotFound 계열 → 404, 선행 단계 미완료/잘못된 전이 → 409, 외부 연동 실패 → 502/504
 * - 요청 바인딩/검증 오류: 400
 * - OptimisticLockingFailureException: 동시성 충돌 (409)
 * - 기타 Exception: 시스템 오류 (500)
 * </pre>
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 비즈니스 예외 처리
     * <p>
     * 상태 코드는 ErrorCode 가 결정한다. 5xx 계열은 error, 나머지는 warn 으로 남긴다.
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        HttpStatus status = e.getErrorCode().getHttpStatus();
        if (status.is5xxServerError()) {
            log.error("비즈니스 예외 발생: code={}, message={}", e.getErrorInfo().getCode(), e.getMessage(), e);
        } else {
            log.warn("비즈니스 예외 발생: code={}, message={}", e.getErrorInfo().getCode(), e.getMessage());
        }

        return ResponseEntity
                .status(status)
                .body(ApiResponse.fail(e.getErrorInfo()));
    }

    /**
     * 요청 본문 검증 실패 (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("요청 검증 실패: {}", detail);

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.fail(ErrorCode.INVALID_INPUT.toErrorInfo(detail)));
    }

    /**
     * 파라미터 누락/형식 오류 (400 Bad Request)
     */
    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadParameter(Exception e) {
        log.warn("요청 파라미터 오류: {}", e.getMessage());

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.fail(ErrorCode.INVALID_INPUT.toErrorInfo(e.getMessage())));
    }

    /**
     * 낙관적 락 충돌 처리 (409 Conflict)
     * <p>
     * 워크플로우 행 잠금으로 직렬화되지 않은 경로에서 @Version 충돌이 나면 발생한다.
     * 클라이언트는 최신 상태를 다시 조회한 뒤 재시도해야 한다.
     */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ApiResponse<Void>> handleOptimisticLockException(
            OptimisticLockingFailureException e) {
        log.warn("낙관적 락 충돌 발생: {}", e.getMessage());

        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(ApiResponse.fail("OPTIMISTIC_LOCK_CONFLICT",
                        "다른 요청이 먼저 처리되었습니다. 다시 시도해주세요."));
    }

    /**
     * 기타 모든 예외 처리 (500 Internal Server Error)
     * <p>
     * 예외 메시지는 클라이언트에 노출하지 않는다.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("예외 발생: ", e);

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.fail(ErrorCode.INTERNAL_ERROR.toErrorInfo()));
    }
}
