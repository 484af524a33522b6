package com.hubhrms.common.idempotency;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubhrms.common.dto.ApiResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    private static final String KEY = "onboarding-docusign:/api/onboarding/steps/1/integrations/docusign:key-1";
    private static final Duration TTL = Duration.ofSeconds(60);

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RBucket<String> bucket;

    private IdempotencyService idempotencyService;

    @BeforeEach
    void setUp() {
        idempotencyService = new IdempotencyService(redissonClient, new ObjectMapper());
        doReturn(bucket).when(redissonClient).getBucket(KEY);
    }

    @Test
    @DisplayName("저장한 응답은 원래 상태 코드(201)와 본문 그대로 다시 읽힌다")
    void complete_thenFind_keepsStatus() {
        // given
        idempotencyService.complete(KEY, 201, ApiResponse.success("envelope-1"), TTL);
        ArgumentCaptor<String> stored = ArgumentCaptor.forClass(String.class);
        verify(bucket).set(stored.capture(), eq(TTL));
        when(bucket.get()).thenReturn(stored.getValue());

        // when
        Optional<IdempotencyEntry> entry = idempotencyService.find(KEY);

        // then
        assertThat(entry).hasValueSatisfying(found -> {
            assertThat(found.isCompleted()).isTrue();
            assertThat(found.status()).isEqualTo(201);
            assertThat(found.body().get("data").asText()).isEqualTo("envelope-1");
            assertThat(found.body().get("success").asBoolean()).isTrue();
        });
    }

    @Test
    @DisplayName("처리 권한은 항목이 없을 때만 얻고, 그 항목은 완료 상태가 아니다")
    void claim_writesProcessingEntry() {
        when(bucket.setIfAbsent(anyString(), eq(TTL))).thenReturn(true);

        assertThat(idempotencyService.claim(KEY, TTL)).isTrue();

        ArgumentCaptor<String> stored = ArgumentCaptor.forClass(String.class);
        verify(bucket).setIfAbsent(stored.capture(), eq(TTL));
        when(bucket.get()).thenReturn(stored.getValue());
        assertThat(idempotencyService.find(KEY))
                .hasValueSatisfying(found -> assertThat(found.isCompleted()).isFalse());
    }

    @Test
    @DisplayName("읽을 수 없는 항목은 지우고 없는 것으로 본다")
    void find_unreadableEntry_released() {
        when(bucket.get()).thenReturn("PROCESSING");

        assertThat(idempotencyService.find(KEY)).isEmpty();
        verify(bucket).delete();
    }
}
