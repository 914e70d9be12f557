package com.ryuqq.chatcommand.core.exception;

/**
 * Guard가 호출을 거부함.
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public class CheckFailure extends CommandException {

    private final String guardName;

    public CheckFailure(String guardName, String message) {
        super(message);
        this.guardName = guardName;
    }

    public CheckFailure(String guardName, String message, Throwable cause) {
        super(message, cause);
        this.guardName = guardName;
    }

    /**
     * 거부한 Guard의 이름.
     *
     * @return Guard 이름
     */
    public String getGuardName() {
        return guardName;
    }
}
