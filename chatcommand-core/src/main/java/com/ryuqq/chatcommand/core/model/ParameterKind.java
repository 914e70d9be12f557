package com.ryuqq.chatcommand.core.model;

/**
 * 파라미터 종류.
 *
 * <ul>
 *   <li>{@link #POSITIONAL}: 순서대로 토큰 하나를 소비</li>
 *   <li>{@link #SPECIAL}: {@code key=value} 형태, 위치와 무관</li>
 *   <li>{@link #CONSUME_REST}: 남은 원본 문자열 전체 (마지막 파라미터만 가능)</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public enum ParameterKind {

    POSITIONAL,

    SPECIAL,

    CONSUME_REST
}
