package com.hubhrms.common.idempotency;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 멱등성 보장 어노테이션
 *
 * 같은 Idempotency Key 로 같은 URI 를 다시 호출하면 저장된 응답을 돌려준다.
 * 외부 서명/신원조회 요청이 사용자 재전송으로 두 번 발송되는 것을 막는 용도.
 *
 * @see <a href="https://datatracker.ietf.org/doc/draft-ietf-httpapi-idempotency-key-header/">IETF Idempotency-Key Header</a>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Idempotent {

    /**
     * Idempotency Key를 추출할 헤더 이름
     */
    String headerName() default "X-Idempotency-Key";

    /**
     * 캐시 유지 시간 (초), 기본 24시간
     */
    long ttlSeconds() default 86400;

    /**
     * Key prefix (Redis key 구분용)
     */
    String prefix() default "idempotency";

    /**
     * Idempotency Key 필수 여부
     *
     * true: Key가 없으면 400 Bad Request
     * false: Key가 없으면 멱등성 체크 없이 실행
     */
    boolean required() default false;
}
