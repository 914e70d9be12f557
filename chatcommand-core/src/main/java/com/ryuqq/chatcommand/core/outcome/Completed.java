package com.ryuqq.chatcommand.core.outcome;

import com.ryuqq.chatcommand.core.context.CommandContext;

/**
 * 정상 완료.
 *
 * @param context 완료된 호출 (상태 COMPLETED)
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public record Completed(CommandContext context) implements DispatchOutcome {

    public Completed {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
    }
}
