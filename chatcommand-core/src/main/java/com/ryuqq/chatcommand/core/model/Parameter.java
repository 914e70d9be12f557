package com.ryuqq.chatcommand.core.model;

import com.ryuqq.chatcommand.core.convert.ArgumentType;

/**
 * 명령이 기대하는 인자 하나의 정적 선언.
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>name: null 또는 빈 문자열 불가, 공백 포함 불가</li>
 *   <li>delimiter: 공백이 아닌 문자 하나 (SPECIAL에서만 의미 있음, 기본값 '=')</li>
 * </ul>
 *
 * <p>파라미터 목록 전체의 불변식(consume-rest 위치, special 연속성)은
 * 명령 빌드 시점에 {@code Command.Builder}가 검증합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Parameter.positional("count", ArgumentType.of(Integer.class)).withDefault(1);
 * Parameter.special("user", ArgumentType.of(String.class));
 * Parameter.special("mode", ArgumentType.of(String.class), ':');
 * Parameter.consumeRest("message", ArgumentType.of(String.class));
 * </pre>
 *
 * @param name 파라미터 이름 (special 파라미터의 키)
 * @param type 선언 타입
 * @param kind 파라미터 종류
 * @param defaultValue 기본값 (null 가능)
 * @param hasDefault 기본값 지정 여부 (null 기본값과 "기본값 없음"을 구분)
 * @param delimiter special 키와 값 사이의 구분 문자
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public record Parameter(
    String name,
    ArgumentType type,
    ParameterKind kind,
    Object defaultValue,
    boolean hasDefault,
    char delimiter
) {

    public static final char DEFAULT_DELIMITER = '=';

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Parameter {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (name.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("name cannot contain whitespace (current: \"" + name + "\")");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (Character.isWhitespace(delimiter) || delimiter == '"') {
            throw new IllegalArgumentException("delimiter must be a single non-whitespace, non-quote character");
        }
        if (!hasDefault && defaultValue != null) {
            throw new IllegalArgumentException("defaultValue requires hasDefault");
        }
    }

    public static Parameter positional(String name, ArgumentType type) {
        return new Parameter(name, type, ParameterKind.POSITIONAL, null, false, DEFAULT_DELIMITER);
    }

    public static Parameter special(String name, ArgumentType type) {
        return special(name, type, DEFAULT_DELIMITER);
    }

    public static Parameter special(String name, ArgumentType type, char delimiter) {
        return new Parameter(name, type, ParameterKind.SPECIAL, null, false, delimiter);
    }

    public static Parameter consumeRest(String name, ArgumentType type) {
        return new Parameter(name, type, ParameterKind.CONSUME_REST, null, false, DEFAULT_DELIMITER);
    }

    /**
     * 기본값을 지정한 새 인스턴스 생성.
     *
     * @param value 기본값 (null 허용)
     * @return 새 Parameter
     */
    public Parameter withDefault(Object value) {
        return new Parameter(name, type, kind, value, true, delimiter);
    }

    /**
     * delimiter만 변경한 새 인스턴스 생성.
     */
    public Parameter withDelimiter(char delimiter) {
        return new Parameter(name, type, kind, defaultValue, hasDefault, delimiter);
    }

    /**
     * 값이 반드시 필요한지 확인.
     *
     * <p>기본값이 없고 optional 타입도 아니면 필수입니다.</p>
     *
     * @return 필수 여부
     */
    public boolean isRequired() {
        return !hasDefault && !type.isOptional();
    }
}
