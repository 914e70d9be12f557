package com.ryuqq.chatcommand.core.exception;

/**
 * 필수 파라미터를 채울 값이 없음.
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public class MissingRequiredArgument extends CommandException {

    private final String parameterName;

    public MissingRequiredArgument(String parameterName) {
        super("Missing required argument \"" + parameterName + "\"");
        this.parameterName = parameterName;
    }

    public String getParameterName() {
        return parameterName;
    }
}
