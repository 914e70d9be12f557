package com.ryuqq.chatcommand.core.cooldown;

/**
 * CooldownManager 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>sweepIntervalMs: 60000 (1분)</li>
 * </ul>
 *
 * @param sweepIntervalMs 오래된 상태를 정리하는 최소 간격 (밀리초, 0이면 매 호출마다)
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public record CooldownManagerConfig(long sweepIntervalMs) {

    public static final long DEFAULT_SWEEP_INTERVAL_MS = 60_000L;

    public CooldownManagerConfig {
        if (sweepIntervalMs < 0) {
            throw new IllegalArgumentException("sweepIntervalMs must be non-negative (current: " + sweepIntervalMs + ")");
        }
    }

    public static CooldownManagerConfig defaultConfig() {
        return new CooldownManagerConfig(DEFAULT_SWEEP_INTERVAL_MS);
    }

    public CooldownManagerConfig withSweepIntervalMs(long newSweepIntervalMs) {
        return new CooldownManagerConfig(newSweepIntervalMs);
    }
}
