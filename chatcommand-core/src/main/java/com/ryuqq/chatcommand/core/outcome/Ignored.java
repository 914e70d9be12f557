package com.ryuqq.chatcommand.core.outcome;

import com.ryuqq.chatcommand.core.model.ChatMessage;

/**
 * 접두사 불일치로 무시됨. 호출 컨텍스트는 만들어지지 않습니다.
 *
 * @param message 무시된 메시지
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public record Ignored(ChatMessage message) implements DispatchOutcome {

    public Ignored {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
    }
}
