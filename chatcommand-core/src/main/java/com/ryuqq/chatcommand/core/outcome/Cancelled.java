package com.ryuqq.chatcommand.core.outcome;

import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.statemachine.DispatchState;

/**
 * 인터럽트로 취소됨.
 *
 * <p>Cooldown 커밋 전에 취소되었다면 cooldown 상태는 변경되지 않습니다.</p>
 *
 * @param context 취소된 호출 (상태 CANCELLED)
 * @param cancelledAt 취소가 관찰된 단계
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public record Cancelled(CommandContext context, DispatchState cancelledAt) implements DispatchOutcome {

    public Cancelled {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (cancelledAt == null) {
            throw new IllegalArgumentException("cancelledAt cannot be null");
        }
    }
}
