package com.hubhrms.common.exception;

import com.hubhrms.common.dto.ErrorInfo;
import lombok.Getter;

/**
 * 비즈니스 예외
 *
 * <p>{@link ErrorCode} 와 함께 던지며, HTTP 상태는 ErrorCode 가 결정한다.</p>
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;
    private final ErrorInfo errorInfo;

    public BusinessException(ErrorCode errorCode) {
        this(errorCode, (String) null);
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail == null ? errorCode.getMessage() : errorCode.getMessage() + " (" + detail + ")");
        this.errorCode = errorCode;
        this.errorInfo = errorCode.toErrorInfo(detail);
    }

    public BusinessException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail == null ? errorCode.getMessage() : errorCode.getMessage() + " (" + detail + ")", cause);
        this.errorCode = errorCode;
        this.errorInfo = errorCode.toErrorInfo(detail);
    }

    public boolean is(ErrorCode code) {
        return this.errorCode == code;
    }
}
