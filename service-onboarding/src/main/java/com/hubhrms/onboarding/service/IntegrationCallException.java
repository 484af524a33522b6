package com.hubhrms.onboarding.service;

import lombok.Getter;

/**
 * 외부 연동 호출 실패 (예외, 타임아웃, 서킷 OPEN)
 * message 는 연동 기록의 error_message 로 그대로 저장된다.
 */
@Getter
public class IntegrationCallException extends RuntimeException {

    private final boolean timeout;

    public IntegrationCallException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }
}
