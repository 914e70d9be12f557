package com.ryuqq.chatcommand.core.cooldown;

import java.time.Duration;

/**
 * Cooldown 평가 결과.
 *
 * <p>허용이면 커밋할 다음 상태를, 거부면 재시도까지 남은 시간을 담습니다.
 * 평가 자체는 상태를 변경하지 않습니다.</p>
 *
 * @param allowed 허용 여부
 * @param retryAfter 재시도까지 남은 시간 (허용이면 {@link Duration#ZERO})
 * @param next 허용 시 커밋할 상태 (거부면 null)
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public record CooldownDecision(boolean allowed, Duration retryAfter, CooldownState next) {

    public CooldownDecision {
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter cannot be null or negative");
        }
        if (allowed && next == null) {
            throw new IllegalArgumentException("next state is required when allowed");
        }
    }

    public static CooldownDecision allow(CooldownState next) {
        return new CooldownDecision(true, Duration.ZERO, next);
    }

    public static CooldownDecision deny(Duration retryAfter) {
        return new CooldownDecision(false, retryAfter, null);
    }
}
