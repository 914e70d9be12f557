package com.ryuqq.chatcommand.core.spi.noop;

import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.spi.MessageSender;

/**
 * Message Sender NoOp 구현.
 *
 * <p>전송 계층 없이 실행할 때 사용합니다. 모든 메시지를 버립니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class NoOpMessageSender implements MessageSender {

    @Override
    public void send(CommandContext context, String text) {
        // discard
    }
}
