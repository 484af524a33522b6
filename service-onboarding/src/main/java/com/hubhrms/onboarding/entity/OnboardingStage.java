package com.hubhrms.onboarding.entity;

import com.hubhrms.common.exception.BusinessException;
import com.hubhrms.common.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * 온보딩 단계 (고정된 선형 순서)
 *
 * <pre>
 * pre-boarding(0) → day-1(25) → week-1(50) → month-1(75) → completed(100)
 * </pre>
 *
 * progress 는 해당 단계에 "진입"했을 때 기록되는 체크포인트 값이다.
 */
@Getter
@RequiredArgsConstructor
public enum OnboardingStage {
    PRE_BOARDING("pre-boarding", 0),
    DAY_1("day-1", 25),
    WEEK_1("week-1", 50),
    MONTH_1("month-1", 75),
    COMPLETED("completed", 100);

    @JsonValue
    private final String value;
    private final int progress;

    public boolean isFinal() {
        return this == COMPLETED;
    }

    /**
     * 다음 단계. completed 이후로는 진행할 수 없다.
     */
    public OnboardingStage next() {
        if (isFinal()) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION, "completed 이후 단계는 없습니다");
        }
        return values()[ordinal() + 1];
    }

    public static OnboardingStage fromValue(String value) {
        return Arrays.stream(values())
                .filter(stage -> stage.value.equalsIgnoreCase(value) || stage.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_INPUT, "unknown stage: " + value));
    }
}
