package com.ryuqq.chatcommand.core.exception;

/**
 * before/after invoke hook에서 발생한 예외를 래핑.
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public class CommandHookError extends CommandInvokeError {

    public CommandHookError(String message, Throwable cause) {
        super(message, cause);
    }
}
