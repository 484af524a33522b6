package com.hubhrms.common.idempotency;

import com.hubhrms.common.dto.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Duration;
import java.util.Optional;

/**
 * @Idempotent 어노테이션 처리 AOP
 *
 * <pre>
 * 1. Key 없음 → required 면 400, 아니면 그대로 실행
 * 2. 처리 완료된 Key → 저장된 상태 코드와 본문 그대로 재전송
 * 3. 처리 중인 Key → 409 (동시 중복 요청)
 * 4. 첫 요청 → 실행 후 응답(상태+본문) 저장, 예외 시 항목 해제
 * </pre>
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class IdempotencyAspect {

    private final IdempotencyService idempotencyService;

    @Around("@annotation(idempotent)")
    public Object handleIdempotency(ProceedingJoinPoint joinPoint, Idempotent idempotent) throws Throwable {
        HttpServletRequest request = currentRequest();
        String idempotencyKey = request == null ? null : request.getHeader(idempotent.headerName());

        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            if (idempotent.required()) {
                log.warn("[Idempotency] 필수 Key 누락 - header: {}", idempotent.headerName());
                return ResponseEntity
                        .status(HttpStatus.BAD_REQUEST)
                        .body(ApiResponse.fail(
                                "IDEMPOTENCY_KEY_REQUIRED",
                                "Idempotency Key is required. Please provide '" + idempotent.headerName() + "' header."
                        ));
            }
            return joinPoint.proceed();
        }

        String cacheKey = idempotencyService.keyFor(idempotent.prefix(), request.getRequestURI(), idempotencyKey);
        Duration ttl = Duration.ofSeconds(idempotent.ttlSeconds());

        Optional<IdempotencyEntry> completed = idempotencyService.find(cacheKey).filter(IdempotencyEntry::isCompleted);
        if (completed.isPresent()) {
            log.info("[Idempotency] 중복 요청, 저장된 응답 재전송 - key: {}, status: {}",
                    idempotencyKey, completed.get().status());
            return ResponseEntity.status(completed.get().status()).body(completed.get().body());
        }

        if (!idempotencyService.claim(cacheKey, ttl)) {
            return ResponseEntity
                    .status(HttpStatus.CONFLICT)
                    .body(ApiResponse.fail("IDEMPOTENCY_KEY_IN_USE",
                            "같은 Idempotency Key 로 처리 중인 요청이 있습니다."));
        }

        Object result;
        try {
            result = joinPoint.proceed();
        } catch (Throwable t) {
            idempotencyService.release(cacheKey);
            throw t;
        }

        if (result instanceof ResponseEntity<?> entity) {
            idempotencyService.complete(cacheKey, entity.getStatusCode().value(), entity.getBody(), ttl);
        } else {
            idempotencyService.complete(cacheKey, HttpStatus.OK.value(), result, ttl);
        }
        return result;
    }

    private HttpServletRequest currentRequest() {
        ServletRequestAttributes attributes =
                (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        return attributes == null ? null : attributes.getRequest();
    }
}
