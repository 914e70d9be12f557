package com.ryuqq.chatcommand.core.cooldown;

import java.time.Duration;
import java.time.Instant;

/**
 * 고정 윈도우 cooldown.
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>상태가 없거나 {@code now > windowStart + period}이면 새 윈도우 시작 (count=0, windowStart=now)</li>
 *   <li>{@code count + 1 > rate}이면 거부, {@code retryAfter = windowStart + period - now}
 *       (윈도우 경계 시각 {@code now == windowStart + period}에서는 최소 1ns)</li>
 *   <li>그 외 허용, count 1 증가</li>
 * </ol>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class FixedWindowCooldown implements Cooldown {

    // 윈도우는 경계 시각이 지나야 재시작되므로 경계에서도 대기 시간이 남음
    private static final Duration MIN_RETRY = Duration.ofNanos(1);

    private final int rate;
    private final Duration period;

    /**
     * @param rate 윈도우당 허용 횟수
     * @param period 윈도우 길이
     * @throws IllegalArgumentException rate가 1 미만이거나 period가 양수가 아닌 경우
     */
    public FixedWindowCooldown(int rate, Duration period) {
        if (rate < 1) {
            throw new IllegalArgumentException("rate must be positive (current: " + rate + ")");
        }
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive (current: " + period + ")");
        }
        this.rate = rate;
        this.period = period;
    }

    @Override
    public CooldownDecision evaluate(CooldownState current, Instant now) {
        int count = 0;
        Instant windowStart = now;
        if (current instanceof CooldownState.WindowState window
            && !now.isAfter(window.windowStart().plus(period))) {
            count = window.count();
            windowStart = window.windowStart();
        }

        if (count + 1 > rate) {
            Duration retryAfter = Duration.between(now, windowStart.plus(period));
            return CooldownDecision.deny(retryAfter.isZero() ? MIN_RETRY : retryAfter);
        }
        return CooldownDecision.allow(new CooldownState.WindowState(count + 1, windowStart, now));
    }

    @Override
    public boolean isStale(CooldownState state, Instant now) {
        return now.isAfter(state.lastUpdated().plus(period));
    }

    @Override
    public int rate() {
        return rate;
    }

    @Override
    public Duration period() {
        return period;
    }

    @Override
    public String toString() {
        return "FixedWindowCooldown{rate=" + rate + ", period=" + period + '}';
    }
}
