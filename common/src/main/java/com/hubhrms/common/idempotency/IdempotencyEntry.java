package com.hubhrms.common.idempotency;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Redis 에 저장되는 멱등성 항목
 *
 * 처리 중(PROCESSING) 항목은 상태만, 완료(COMPLETED) 항목은 원래 HTTP 상태와 본문을 가진다.
 */
public record IdempotencyEntry(State state, int status, JsonNode body) {

    public enum State {
        PROCESSING,
        COMPLETED
    }

    static IdempotencyEntry processing() {
        return new IdempotencyEntry(State.PROCESSING, 0, null);
    }

    static IdempotencyEntry completed(int status, JsonNode body) {
        return new IdempotencyEntry(State.COMPLETED, status, body);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return state == State.COMPLETED;
    }
}
