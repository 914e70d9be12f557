package com.ryuqq.chatcommand.core.cooldown;

import java.time.Duration;
import java.time.Instant;

/**
 * Cooldown 알고리즘.
 *
 * <p>구현은 상태를 갖지 않습니다. 키별 상태는 {@link CooldownManager}가 보관하고,
 * 알고리즘은 (현재 상태, 현재 시각) → 결정만 계산합니다.</p>
 *
 * <p><strong>기본 구현:</strong></p>
 * <ul>
 *   <li>{@link FixedWindowCooldown}: 고정 윈도우 카운터</li>
 *   <li>{@link GcraCooldown}: Generic Cell Rate Algorithm</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public interface Cooldown {

    /**
     * 호출 허용 여부 평가.
     *
     * @param current 현재 상태 (처음이면 null)
     * @param now 현재 시각
     * @return 결정 (상태 변경 없음)
     */
    CooldownDecision evaluate(CooldownState current, Instant now);

    /**
     * 상태가 더 이상 결정에 영향을 주지 않아 제거해도 되는지 확인.
     *
     * @param state 상태
     * @param now 현재 시각
     * @return 제거 가능하면 true
     */
    boolean isStale(CooldownState state, Instant now);

    int rate();

    Duration period();
}
