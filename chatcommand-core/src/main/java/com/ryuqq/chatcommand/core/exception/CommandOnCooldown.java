package com.ryuqq.chatcommand.core.exception;

import java.time.Duration;
import java.util.Locale;

/**
 * Cooldown이 호출을 거부함.
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public class CommandOnCooldown extends CommandException {

    private final String commandName;
    private final Duration retryAfter;

    public CommandOnCooldown(String commandName, Duration retryAfter) {
        super(String.format(Locale.ROOT, "Command <%s> is on cooldown. Try again in (%.2f)s",
            commandName, displaySeconds(retryAfter)));
        this.commandName = commandName;
        this.retryAfter = retryAfter;
    }

    // 0.01초 단위로 올림, 남은 시간이 있으면 0.00으로 표시하지 않음
    private static double displaySeconds(Duration retryAfter) {
        long hundredths = (retryAfter.toNanos() + 9_999_999L) / 10_000_000L;
        return hundredths / 100.0;
    }

    public String getCommandName() {
        return commandName;
    }

    /**
     * 다시 시도할 수 있을 때까지 남은 시간.
     *
     * @return 0 이상의 Duration
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
