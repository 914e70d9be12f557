package com.ryuqq.chatcommand.core.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 파라미터 이름 → 변환된 값 매핑.
 *
 * <p>선언 순서를 유지하며, "값 없음"(optional, null 기본값)은 null로 저장됩니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class BoundArguments {

    private static final BoundArguments EMPTY = new BoundArguments(new LinkedHashMap<>());

    private final Map<String, Object> values;

    private BoundArguments(LinkedHashMap<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static BoundArguments empty() {
        return EMPTY;
    }

    /**
     * 바인딩 결과로 생성 (복사).
     *
     * @param values 이름 → 값 (null 값 허용)
     * @return BoundArguments
     */
    public static BoundArguments of(Map<String, Object> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        return new BoundArguments(new LinkedHashMap<>(values));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * 값 조회.
     *
     * @param name 파라미터 이름
     * @return 값 (값 없음이면 null)
     * @throws IllegalArgumentException 바인딩되지 않은 이름인 경우
     */
    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("No argument bound for parameter \"" + name + "\"");
        }
        return values.get(name);
    }

    /**
     * 타입을 지정해 값 조회.
     *
     * @param name 파라미터 이름
     * @param type 기대 타입
     * @param <T> 기대 타입
     * @return 값 (값 없음이면 null)
     * @throws ClassCastException 값의 타입이 다른 경우
     */
    public <T> T get(String name, Class<T> type) {
        return type.cast(get(name));
    }

    public int size() {
        return values.size();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "BoundArguments" + values;
    }
}
