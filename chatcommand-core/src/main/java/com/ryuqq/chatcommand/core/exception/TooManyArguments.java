package com.ryuqq.chatcommand.core.exception;

/**
 * 선언된 positional 파라미터보다 많은 토큰이 입력됨.
 *
 * <p>{@code ignoreExtraArguments=false}로 빌드된 명령에서만 발생합니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public class TooManyArguments extends ArgumentParsingFailed {

    public TooManyArguments(String commandName, int position) {
        super("Too many arguments passed to command \"" + commandName + "\"", position);
    }
}
