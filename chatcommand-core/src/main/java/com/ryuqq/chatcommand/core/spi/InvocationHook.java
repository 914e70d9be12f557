package com.ryuqq.chatcommand.core.spi;

import com.ryuqq.chatcommand.core.context.CommandContext;

/**
 * 명령 본문 전후에 실행되는 훅.
 *
 * <p>{@link #before(CommandContext)}는 Guard와 Cooldown을 모두 통과한 뒤,
 * {@link #after(CommandContext)}는 본문이 정상 완료된 경우에만 실행됩니다.
 * 훅이 던진 예외는 {@code CommandHookError}로 래핑됩니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public interface InvocationHook {

    default void before(CommandContext context) throws Exception {
    }

    default void after(CommandContext context) throws Exception {
    }
}
