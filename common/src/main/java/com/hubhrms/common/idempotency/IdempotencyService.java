package com.hubhrms.common.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * 멱등성 항목 저장소 (Redisson RBucket, 다중 인스턴스 공유)
 *
 * <pre>
 * claim    : 항목이 없을 때만 PROCESSING 을 넣는다 (setIfAbsent)
 * complete : 응답 상태/본문으로 덮어쓴다
 * release  : 실패한 요청의 항목을 지워 같은 Key 로 다시 보낼 수 있게 한다
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotencyService {

    private final RedissonClient redissonClient;
    private final ObjectMapper objectMapper;

    /**
     * 같은 Key 라도 대상 리소스(URI)가 다르면 별개 요청으로 본다
     */
    public String keyFor(String prefix, String requestUri, String idempotencyKey) {
        return prefix + ":" + requestUri + ":" + idempotencyKey;
    }

    public Optional<IdempotencyEntry> find(String key) {
        String json = bucket(key).get();
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, IdempotencyEntry.class));
        } catch (JsonProcessingException e) {
            log.error("[Idempotency] 저장된 항목을 읽을 수 없어 버림 - key: {}", key, e);
            release(key);
            return Optional.empty();
        }
    }

    /**
     * @return true: 이 요청이 처리 권한을 얻음, false: 다른 요청이 처리 중이거나 이미 완료
     */
    public boolean claim(String key, Duration ttl) {
        boolean claimed = bucket(key).setIfAbsent(write(IdempotencyEntry.processing()), ttl);
        if (!claimed) {
            log.warn("[Idempotency] 이미 사용 중인 Key - key: {}", key);
        }
        return claimed;
    }

    /**
     * 저장 실패는 이미 끝난 처리 결과에 영향을 주지 않는다. 항목만 지워 재요청이 가능하게 한다.
     */
    public void complete(String key, int status, Object body, Duration ttl) {
        try {
            IdempotencyEntry entry = IdempotencyEntry.completed(status, objectMapper.valueToTree(body));
            bucket(key).set(write(entry), ttl);
            log.info("[Idempotency] 응답 저장 - key: {}, status: {}, ttl: {}초", key, status, ttl.toSeconds());
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("[Idempotency] 응답 직렬화 실패 - key: {}", key, e);
            release(key);
        }
    }

    public void release(String key) {
        bucket(key).delete();
    }

    private RBucket<String> bucket(String key) {
        return redissonClient.getBucket(key);
    }

    private String write(IdempotencyEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("멱등성 항목 직렬화 실패: state=" + entry.state(), e);
        }
    }
}
