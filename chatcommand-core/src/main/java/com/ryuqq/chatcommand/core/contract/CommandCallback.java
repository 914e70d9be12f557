package com.ryuqq.chatcommand.core.contract;

import com.ryuqq.chatcommand.core.context.CommandContext;

/**
 * 명령 본문.
 *
 * <p>던진 예외는 {@code CommandInvokeError}로 래핑되어 보고됩니다.
 * 블로킹할 수 있으며, 인터럽트되면 {@link InterruptedException}을 던져 취소를 알립니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandCallback {

    /**
     * @param context 인자 바인딩, Guard, Cooldown을 모두 통과한 호출 컨텍스트
     * @throws Exception 본문 실패
     */
    void invoke(CommandContext context) throws Exception;
}
