package com.hubhrms.common.idempotency;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubhrms.common.dto.ApiResponse;
import org.aspectj.lang.ProceedingJoinPoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdempotencyAspectTest {

    private static final String URI = "/api/onboarding/steps/1/integrations/docusign";
    private static final String CACHE_KEY = "test:" + URI + ":key-1";
    private static final Duration TTL = Duration.ofSeconds(60);

    @Mock
    private IdempotencyService idempotencyService;

    @Mock
    private ProceedingJoinPoint joinPoint;

    private IdempotencyAspect aspect;
    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        aspect = new IdempotencyAspect(idempotencyService);
        request = new MockHttpServletRequest("POST", URI);
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));
    }

    @AfterEach
    void tearDown() {
        RequestContextHolder.resetRequestAttributes();
    }

    @Test
    @DisplayName("Key 가 없고 선택 사항이면 그대로 실행한다")
    void noKey_optional_proceeds() throws Throwable {
        when(joinPoint.proceed()).thenReturn("ok");

        Object result = aspect.handleIdempotency(joinPoint, annotation("optional"));

        assertThat(result).isEqualTo("ok");
        verify(idempotencyService, never()).claim(anyString(), any());
    }

    @Test
    @DisplayName("Key 가 필수인데 없으면 400 을 돌려주고 실행하지 않는다")
    void noKey_required_badRequest() throws Throwable {
        Object result = aspect.handleIdempotency(joinPoint, annotation("required"));

        assertThat(result).isInstanceOf(ResponseEntity.class);
        assertThat(((ResponseEntity<?>) result).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verify(joinPoint, never()).proceed();
    }

    @Test
    @DisplayName("처리 완료된 Key 는 저장된 상태 코드와 본문을 그대로 돌려주고 실행하지 않는다")
    void processedKey_replaysStoredStatusAndBody() throws Throwable {
        request.addHeader("X-Idempotency-Key", "key-1");
        JsonNode body = new ObjectMapper().readTree("{\"success\":true,\"data\":\"envelope-1\"}");
        when(idempotencyService.keyFor("test", URI, "key-1")).thenReturn(CACHE_KEY);
        when(idempotencyService.find(CACHE_KEY)).thenReturn(Optional.of(new IdempotencyEntry(
                IdempotencyEntry.State.COMPLETED, HttpStatus.CREATED.value(), body)));

        Object result = aspect.handleIdempotency(joinPoint, annotation("optional"));

        ResponseEntity<?> entity = (ResponseEntity<?>) result;
        assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(((JsonNode) entity.getBody()).get("data").asText()).isEqualTo("envelope-1");
        verify(joinPoint, never()).proceed();
    }

    @Test
    @DisplayName("처리 중인 Key 로 동시에 들어온 요청은 409")
    void processingKey_conflict() throws Throwable {
        request.addHeader("X-Idempotency-Key", "key-1");
        when(idempotencyService.keyFor("test", URI, "key-1")).thenReturn(CACHE_KEY);
        when(idempotencyService.find(CACHE_KEY)).thenReturn(Optional.of(new IdempotencyEntry(
                IdempotencyEntry.State.PROCESSING, 0, null)));
        when(idempotencyService.claim(CACHE_KEY, TTL)).thenReturn(false);

        Object result = aspect.handleIdempotency(joinPoint, annotation("optional"));

        assertThat(((ResponseEntity<?>) result).getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        verify(joinPoint, never()).proceed();
    }

    @Test
    @DisplayName("첫 요청이 성공하면 ResponseEntity 의 상태 코드와 본문을 저장한다")
    void firstRequest_savesBody() throws Throwable {
        request.addHeader("X-Idempotency-Key", "key-1");
        ApiResponse<String> body = ApiResponse.success("envelope-1");
        when(idempotencyService.keyFor("test", URI, "key-1")).thenReturn(CACHE_KEY);
        when(idempotencyService.find(CACHE_KEY)).thenReturn(Optional.empty());
        when(idempotencyService.claim(CACHE_KEY, TTL)).thenReturn(true);
        when(joinPoint.proceed()).thenReturn(ResponseEntity.status(HttpStatus.CREATED).body(body));

        aspect.handleIdempotency(joinPoint, annotation("optional"));

        verify(idempotencyService).complete(CACHE_KEY, 201, body, TTL);
    }

    @Test
    @DisplayName("실행 중 예외가 나면 마커를 지우고 예외를 그대로 던진다")
    void failure_releasesKey() throws Throwable {
        request.addHeader("X-Idempotency-Key", "key-1");
        when(idempotencyService.keyFor("test", URI, "key-1")).thenReturn(CACHE_KEY);
        when(idempotencyService.find(CACHE_KEY)).thenReturn(Optional.empty());
        when(idempotencyService.claim(CACHE_KEY, TTL)).thenReturn(true);
        when(joinPoint.proceed()).thenThrow(new IllegalStateException("docusign down"));

        assertThatThrownBy(() -> aspect.handleIdempotency(joinPoint, annotation("optional")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("docusign down");

        verify(idempotencyService).release(CACHE_KEY);
        verify(idempotencyService, never()).complete(eq(CACHE_KEY), anyInt(), any(), any());
    }

    private static Idempotent annotation(String methodName) throws NoSuchMethodException {
        return Annotated.class.getDeclaredMethod(methodName).getAnnotation(Idempotent.class);
    }

    static class Annotated {

        @Idempotent(prefix = "test", ttlSeconds = 60)
        void optional() {
        }

        @Idempotent(prefix = "test", ttlSeconds = 60, required = true)
        void required() {
        }
    }
}
