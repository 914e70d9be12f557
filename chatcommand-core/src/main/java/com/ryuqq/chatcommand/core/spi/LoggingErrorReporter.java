package com.ryuqq.chatcommand.core.spi;

import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.exception.CommandException;
import com.ryuqq.chatcommand.core.exception.CommandInvokeError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 오류를 로그로만 남기는 기본 {@link ErrorReporter}.
 *
 * <p>명령 본문/훅 오류({@link CommandInvokeError})는 스택 트레이스와 함께 ERROR로,
 * 나머지(입력 오류, Guard/Cooldown 거부)는 사용자 입력에 의한 것이므로 DEBUG로 기록합니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class LoggingErrorReporter implements ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingErrorReporter.class);

    @Override
    public void report(CommandContext context, CommandException error) {
        if (error instanceof CommandInvokeError) {
            log.error("Ignoring exception in command \"{}\": {}",
                context.getInvokedWith(), error.getMessage(), error.getCause());
            return;
        }
        log.debug("Command \"{}\" failed: {}", context.getInvokedWith(), error.getMessage());
    }
}
