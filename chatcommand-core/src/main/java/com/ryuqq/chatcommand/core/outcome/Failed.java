package com.ryuqq.chatcommand.core.outcome;

import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.exception.CommandException;
import com.ryuqq.chatcommand.core.statemachine.DispatchState;

/**
 * 실패.
 *
 * <p>실패한 단계는 {@code context}에 남지 않으므로 (상태는 FAILED) {@code failedAt}으로 보존합니다.</p>
 *
 * @param context 실패한 호출 (상태 FAILED)
 * @param error 오류 분류 값
 * @param failedAt 실패가 발생한 단계
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public record Failed(
    CommandContext context,
    CommandException error,
    DispatchState failedAt
) implements DispatchOutcome {

    public Failed {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        if (failedAt == null) {
            throw new IllegalArgumentException("failedAt cannot be null");
        }
    }
}
