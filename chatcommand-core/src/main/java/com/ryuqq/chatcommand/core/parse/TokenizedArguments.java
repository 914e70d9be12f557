package com.ryuqq.chatcommand.core.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 토큰화 결과.
 *
 * @param positional positional 토큰 (입력 순서)
 * @param specials special 키 → 원본 값
 * @param rest consume-rest 파라미터에 전달될 원본 나머지 (없으면 null)
 * @param restPosition rest의 시작 offset (rest가 없으면 -1)
 * @param source 토큰화한 원본 인자 문자열
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public record TokenizedArguments(
    List<Token> positional,
    Map<String, String> specials,
    String rest,
    int restPosition,
    String source
) {

    public TokenizedArguments {
        if (positional == null) {
            throw new IllegalArgumentException("positional cannot be null");
        }
        if (specials == null) {
            throw new IllegalArgumentException("specials cannot be null");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        positional = List.copyOf(positional);
        specials = Collections.unmodifiableMap(new LinkedHashMap<>(specials));
    }

    public static TokenizedArguments empty() {
        return new TokenizedArguments(List.of(), Map.of(), null, -1, "");
    }

    public boolean hasRest() {
        return rest != null;
    }

    /**
     * 주어진 offset부터의 원본 나머지.
     *
     * <p>positional 토큰이 소비되지 않고 consume-rest 경계 앞에 남은 경우,
     * 그 토큰부터 다시 나머지를 구성할 때 사용합니다.</p>
     *
     * @param position 시작 offset
     * @return 원본 문자열의 substring
     */
    public String restFrom(int position) {
        return source.substring(position);
    }

    /**
     * positional 토큰 값 목록.
     *
     * @return 값 목록
     */
    public List<String> positionalValues() {
        return positional.stream().map(Token::value).toList();
    }
}
