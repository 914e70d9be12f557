package com.ryuqq.chatcommand.core.cooldown;

import java.time.Duration;
import java.time.Instant;

/**
 * GCRA (Generic Cell Rate Algorithm) cooldown.
 *
 * <p>키마다 TAT(Theoretical Arrival Time) 하나만 보관합니다.</p>
 *
 * <p><strong>파라미터:</strong></p>
 * <ul>
 *   <li>{@code T = period / rate}: 호출 간 이상적인 간격</li>
 *   <li>{@code tau = T * (burst - 1)}: 허용되는 연속 호출 여유</li>
 *   <li>burst 기본값은 rate</li>
 * </ul>
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>{@code now >= TAT}: 허용, {@code TAT' = now + T}</li>
 *   <li>{@code TAT - now <= tau}: 허용, {@code TAT' = TAT + T}</li>
 *   <li>그 외: 거부, {@code retryAfter = TAT - tau - now}</li>
 * </ol>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class GcraCooldown implements Cooldown {

    private final int rate;
    private final int burst;
    private final Duration period;
    private final Duration emissionInterval;
    private final Duration tolerance;

    public GcraCooldown(int rate, Duration period) {
        this(rate, period, rate);
    }

    /**
     * @param rate period당 허용 횟수
     * @param period 기준 기간
     * @param burst 연속 허용 횟수
     * @throws IllegalArgumentException rate 또는 burst가 1 미만이거나 period가 양수가 아닌 경우
     */
    public GcraCooldown(int rate, Duration period, int burst) {
        if (rate < 1) {
            throw new IllegalArgumentException("rate must be positive (current: " + rate + ")");
        }
        if (burst < 1) {
            throw new IllegalArgumentException("burst must be positive (current: " + burst + ")");
        }
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive (current: " + period + ")");
        }
        this.rate = rate;
        this.burst = burst;
        this.period = period;
        this.emissionInterval = period.dividedBy(rate);
        this.tolerance = emissionInterval.multipliedBy(burst - 1L);
    }

    @Override
    public CooldownDecision evaluate(CooldownState current, Instant now) {
        Instant tat = current instanceof CooldownState.TatState state ? state.tat() : null;

        if (tat == null || !now.isBefore(tat)) {
            return CooldownDecision.allow(new CooldownState.TatState(now.plus(emissionInterval), now));
        }

        Duration separation = Duration.between(now, tat);
        if (separation.compareTo(tolerance) <= 0) {
            return CooldownDecision.allow(new CooldownState.TatState(tat.plus(emissionInterval), now));
        }
        return CooldownDecision.deny(separation.minus(tolerance));
    }

    @Override
    public boolean isStale(CooldownState state, Instant now) {
        Instant horizon = state.lastUpdated().plus(period);
        if (state instanceof CooldownState.TatState tatState && tatState.tat().isAfter(horizon)) {
            horizon = tatState.tat();
        }
        return now.isAfter(horizon);
    }

    @Override
    public int rate() {
        return rate;
    }

    @Override
    public Duration period() {
        return period;
    }

    public int burst() {
        return burst;
    }

    /**
     * 호출 간 이상적인 간격 (T).
     */
    public Duration emissionInterval() {
        return emissionInterval;
    }

    /**
     * 허용 여유 (tau).
     */
    public Duration tolerance() {
        return tolerance;
    }

    @Override
    public String toString() {
        return "GcraCooldown{rate=" + rate + ", period=" + period + ", burst=" + burst + '}';
    }
}
