package com.ryuqq.chatcommand.core.exception;

/**
 * 같은 스코프 안에서 이름/별칭이 이미 등록되어 있음.
 *
 * <p>Dispatch 경로가 아니라 등록 호출자에게 동기적으로 던져집니다.
 * 예외가 발생하면 레지스트리는 변경되지 않습니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public class CommandExistsError extends CommandException {

    private final String conflictingName;

    public CommandExistsError(String conflictingName, String existingCommand) {
        super("The name \"" + conflictingName + "\" is already registered by command \"" + existingCommand + "\"");
        this.conflictingName = conflictingName;
    }

    public String getConflictingName() {
        return conflictingName;
    }
}
