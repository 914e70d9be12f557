package com.ryuqq.chatcommand.core.cooldown;

import java.time.Instant;

/**
 * 키 하나에 대한 cooldown 상태 스냅샷 (불변).
 *
 * <ul>
 *   <li>{@link WindowState}: 고정 윈도우 (횟수, 윈도우 시작)</li>
 *   <li>{@link TatState}: GCRA (Theoretical Arrival Time)</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public sealed interface CooldownState permits CooldownState.WindowState, CooldownState.TatState {

    /**
     * 마지막으로 호출을 허용한 시각.
     *
     * @return 마지막 갱신 시각
     */
    Instant lastUpdated();

    /**
     * @param count 현재 윈도우에서 허용된 호출 수
     * @param windowStart 윈도우 시작 시각
     * @param lastUpdated 마지막 갱신 시각
     */
    record WindowState(int count, Instant windowStart, Instant lastUpdated) implements CooldownState {

        public WindowState {
            if (count < 0) {
                throw new IllegalArgumentException("count must be non-negative (current: " + count + ")");
            }
            if (windowStart == null || lastUpdated == null) {
                throw new IllegalArgumentException("windowStart and lastUpdated cannot be null");
            }
        }
    }

    /**
     * @param tat 다음 호출이 "제때" 도착하는 이론적 시각
     * @param lastUpdated 마지막 갱신 시각
     */
    record TatState(Instant tat, Instant lastUpdated) implements CooldownState {

        public TatState {
            if (tat == null || lastUpdated == null) {
                throw new IllegalArgumentException("tat and lastUpdated cannot be null");
            }
        }
    }
}
