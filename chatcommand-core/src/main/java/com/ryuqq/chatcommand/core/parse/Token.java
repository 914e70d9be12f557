package com.ryuqq.chatcommand.core.parse;

/**
 * Positional 토큰 하나.
 *
 * @param value 따옴표와 이스케이프가 처리된 값
 * @param position 인자 문자열 기준 시작 offset
 * @param quoted 따옴표로 감싸져 있었는지 여부
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public record Token(String value, int position, boolean quoted) {

    public Token {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative (current: " + position + ")");
        }
    }
}
