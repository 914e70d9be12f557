package com.ryuqq.chatcommand.core.parse;

import com.ryuqq.chatcommand.core.exception.ArgumentParsingFailed;
import com.ryuqq.chatcommand.core.model.Parameter;
import com.ryuqq.chatcommand.core.model.ParameterKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 인자 문자열을 positional 토큰, special 값, consume-rest 나머지로 분리.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>공백(이스케이프되지 않은)으로 토큰 구분</li>
 *   <li>토큰 시작의 {@code "}부터 닫는 {@code "}까지가 한 토큰. 내부의 {@code \"}는 따옴표 문자</li>
 *   <li>닫는 따옴표 뒤에는 공백 또는 입력 끝만 올 수 있음</li>
 *   <li>따옴표 없는 토큰 중간의 {@code "}는 일반 문자</li>
 *   <li>{@code key<delim>value} 형태이고 key가 선언된 special이면 위치와 관계없이 positional 흐름에서 제거.
 *       value는 따옴표로 감쌀 수 있음</li>
 *   <li>positional 파라미터가 모두 채워진 뒤 나오는 첫 토큰(special 제외)부터 입력 끝까지는
 *       consume-rest 값으로 원본 그대로 보존 (공백, 따옴표 포함)</li>
 * </ul>
 *
 * <p><strong>오류 ({@link ArgumentParsingFailed}):</strong></p>
 * <ul>
 *   <li>닫히지 않은 따옴표</li>
 *   <li>special 구분 문자를 쓰는 토큰인데 key가 선언되지 않음</li>
 *   <li>같은 special key가 두 번 입력됨</li>
 * </ul>
 *
 * <p>블로킹하지 않으며 상태가 없습니다 (thread-safe).</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class Tokenizer {

    private static final char QUOTE = '"';
    private static final char ESCAPE = '\\';

    // Utility class - prevent instantiation
    private Tokenizer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 인자 문자열 토큰화.
     *
     * @param input 명령 이름 뒤의 인자 문자열
     * @param parameters 명령의 파라미터 선언 (선언 순서)
     * @return 토큰화 결과
     * @throws ArgumentParsingFailed 입력 형식이 잘못된 경우
     * @throws IllegalArgumentException input 또는 parameters가 null인 경우
     */
    public static TokenizedArguments tokenize(String input, List<Parameter> parameters) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters cannot be null");
        }
        return new Scanner(input, parameters).scan();
    }

    /**
     * 한 번의 토큰화 작업 상태.
     */
    private static final class Scanner {

        private final String input;
        private final int length;
        private final Map<String, Character> specialDelimiters = new HashMap<>();
        private final Set<Character> delimiters = new HashSet<>();
        private final int positionalCount;
        private final boolean hasRest;

        private final List<Token> positional = new ArrayList<>();
        private final Map<String, String> specials = new LinkedHashMap<>();
        private int cursor;

        Scanner(String input, List<Parameter> parameters) {
            this.input = input;
            this.length = input.length();
            int count = 0;
            boolean rest = false;
            for (Parameter parameter : parameters) {
                if (parameter.kind() == ParameterKind.SPECIAL) {
                    specialDelimiters.put(parameter.name(), parameter.delimiter());
                    delimiters.add(parameter.delimiter());
                } else if (parameter.kind() == ParameterKind.POSITIONAL) {
                    count++;
                } else {
                    rest = true;
                }
            }
            this.positionalCount = count;
            this.hasRest = rest;
        }

        TokenizedArguments scan() {
            while (true) {
                skipWhitespace();
                if (cursor >= length) {
                    return new TokenizedArguments(positional, specials, null, -1, input);
                }
                int start = cursor;

                if (hasRest && positional.size() >= positionalCount) {
                    SpecialMatch match = matchSpecial(start);
                    if (match == null || !match.declared()) {
                        return new TokenizedArguments(positional, specials, input.substring(start), start, input);
                    }
                    readSpecial(match);
                    continue;
                }

                if (input.charAt(start) == QUOTE) {
                    String value = readQuoted(start);
                    positional.add(new Token(value, start, true));
                    continue;
                }

                SpecialMatch match = matchSpecial(start);
                if (match != null) {
                    if (!match.declared()) {
                        throw new ArgumentParsingFailed(
                            "Unknown special argument \"" + match.key() + "\"", start);
                    }
                    readSpecial(match);
                    continue;
                }

                int end = endOfWord(start);
                positional.add(new Token(input.substring(start, end), start, false));
                cursor = end;
            }
        }

        /**
         * 토큰이 {@code key<delim>} 형태인지 확인.
         *
         * @return 일치 정보 (special 형태가 아니면 null)
         */
        private SpecialMatch matchSpecial(int start) {
            if (delimiters.isEmpty() || input.charAt(start) == QUOTE) {
                return null;
            }
            for (int i = start; i < length; i++) {
                char c = input.charAt(i);
                if (Character.isWhitespace(c)) {
                    return null;
                }
                if (i > start && delimiters.contains(c)) {
                    String key = input.substring(start, i);
                    Character declared = specialDelimiters.get(key);
                    return new SpecialMatch(key, start, i, declared != null && declared == c);
                }
            }
            return null;
        }

        private void readSpecial(SpecialMatch match) {
            if (specials.containsKey(match.key())) {
                throw new ArgumentParsingFailed(
                    "Special argument \"" + match.key() + "\" was given more than once", match.start());
            }
            int valueStart = match.delimiterIndex() + 1;
            String value;
            if (valueStart < length && input.charAt(valueStart) == QUOTE) {
                value = readQuoted(valueStart);
            } else {
                int end = endOfWord(valueStart);
                value = input.substring(valueStart, end);
                cursor = end;
            }
            specials.put(match.key(), value);
        }

        /**
         * {@code start}의 여는 따옴표부터 닫는 따옴표까지 읽고 cursor를 그 뒤로 이동.
         */
        private String readQuoted(int start) {
            StringBuilder value = new StringBuilder();
            int i = start + 1;
            while (i < length) {
                char c = input.charAt(i);
                if (c == ESCAPE && i + 1 < length && input.charAt(i + 1) == QUOTE) {
                    value.append(QUOTE);
                    i += 2;
                    continue;
                }
                if (c == QUOTE) {
                    int after = i + 1;
                    if (after < length && !Character.isWhitespace(input.charAt(after))) {
                        throw new ArgumentParsingFailed("Expected whitespace after closing quote", after);
                    }
                    cursor = after;
                    return value.toString();
                }
                value.append(c);
                i++;
            }
            throw new ArgumentParsingFailed("Unterminated quoted argument", start);
        }

        private int endOfWord(int start) {
            int i = start;
            while (i < length && !Character.isWhitespace(input.charAt(i))) {
                i++;
            }
            return i;
        }

        private void skipWhitespace() {
            while (cursor < length && Character.isWhitespace(input.charAt(cursor))) {
                cursor++;
            }
        }
    }

    private record SpecialMatch(String key, int start, int delimiterIndex, boolean declared) {
    }
}
