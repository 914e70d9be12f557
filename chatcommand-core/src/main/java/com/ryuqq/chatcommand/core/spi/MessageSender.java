package com.ryuqq.chatcommand.core.spi;

import com.ryuqq.chatcommand.core.context.CommandContext;

/**
 * 채팅 메시지 전송 SPI.
 *
 * <p>명령 본문에서 {@link CommandContext#send(String)}를 통해서만 호출됩니다.
 * 전송 방식(IRC, HTTP API 등)은 구현이 결정합니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageSender {

    /**
     * 메시지를 호출이 발생한 채널로 전송.
     *
     * @param context 현재 호출 컨텍스트
     * @param text 전송할 본문
     * @throws Exception 전송 실패 시 (본문 예외로 취급되어 CommandInvokeError로 래핑됨)
     */
    void send(CommandContext context, String text) throws Exception;
}
