package com.ryuqq.chatcommand.core.exception;

/**
 * 토큰화 단계에서 입력 형식이 잘못됨.
 *
 * <p>닫히지 않은 따옴표, 선언되지 않은 special 키, 중복된 special 키 등이 해당합니다.
 * 변환이 시작되기 전에 보고됩니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public class ArgumentParsingFailed extends CommandException {

    private final int position;

    /**
     * @param message 오류 메시지
     * @param position 문제가 된 토큰의 시작 위치 (인자 문자열 기준, 0부터)
     */
    public ArgumentParsingFailed(String message, int position) {
        super(message + " (at position " + position + ")");
        this.position = position;
    }

    /**
     * 문제가 된 토큰의 시작 위치.
     *
     * @return 인자 문자열 기준 offset
     */
    public int getPosition() {
        return position;
    }
}
