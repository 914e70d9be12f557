package com.ryuqq.chatcommand.core.exception;

/**
 * 이름 또는 별칭에 해당하는 명령이 없음.
 *
 * <p>보고 대상이지만 치명적이지 않습니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public class CommandNotFound extends CommandException {

    private final String invokedWith;

    public CommandNotFound(String invokedWith) {
        super("The command \"" + invokedWith + "\" was not found.");
        this.invokedWith = invokedWith;
    }

    /**
     * 사용자가 입력한 명령 이름 (하위 명령 포함).
     *
     * @return 입력된 이름
     */
    public String getInvokedWith() {
        return invokedWith;
    }
}
