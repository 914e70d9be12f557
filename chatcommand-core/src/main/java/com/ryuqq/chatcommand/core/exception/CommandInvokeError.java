package com.ryuqq.chatcommand.core.exception;

/**
 * 명령 본문에서 발생한 예외를 래핑.
 *
 * <p>원본 예외는 {@link #getCause()}로 보존됩니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public class CommandInvokeError extends CommandException {

    public CommandInvokeError(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 원본 예외.
     *
     * @return 명령 본문이 던진 예외
     */
    public Throwable getOriginal() {
        return getCause();
    }
}
