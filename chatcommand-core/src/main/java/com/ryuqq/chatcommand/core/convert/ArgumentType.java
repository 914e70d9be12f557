package com.ryuqq.chatcommand.core.convert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 파라미터의 선언 타입.
 *
 * <p>구체 타입(Class), 커스텀 변환기, 또는 이들의 union으로 선언합니다.
 * Union의 변형(variant)은 선언 순서대로 시도되며, 첫 번째 성공 값이 사용됩니다.
 * {@link #optional(ArgumentType...)}은 마지막에 "값 없음" 변형이 붙은 union입니다.</p>
 *
 * <p>런타임 타입 검사에 의존하지 않고, 변형 목록을 명시적으로 보관합니다.
 * 실제 {@link Converter}로의 매핑은 명령 빌드 시점에 {@link ConverterRegistry}가 수행합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ArgumentType.of(Integer.class);                          // int
 * ArgumentType.union(ArgumentType.of(Integer.class),
 *                    ArgumentType.of(String.class));       // int | str
 * ArgumentType.optional(ArgumentType.of(Integer.class));   // Optional[int]
 * ArgumentType.of(new ColorConverter());                   // 커스텀 변환기
 * </pre>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class ArgumentType {

    private final List<Variant> variants;
    private final boolean optional;

    private ArgumentType(List<Variant> variants, boolean optional) {
        if (variants.isEmpty()) {
            throw new IllegalArgumentException("ArgumentType requires at least one variant");
        }
        this.variants = Collections.unmodifiableList(variants);
        this.optional = optional;
    }

    /**
     * 구체 타입으로 선언.
     *
     * @param type 변환 대상 타입 (ConverterRegistry에 등록되어 있어야 함)
     * @return ArgumentType
     * @throws IllegalArgumentException type이 null인 경우
     */
    public static ArgumentType of(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return new ArgumentType(List.of(new TypeVariant(type)), false);
    }

    /**
     * 커스텀 변환기로 선언.
     *
     * @param converter 변환기 (함수형 또는 클래스형)
     * @return ArgumentType
     * @throws IllegalArgumentException converter가 null인 경우
     */
    public static ArgumentType of(Converter<?> converter) {
        if (converter == null) {
            throw new IllegalArgumentException("converter cannot be null");
        }
        return new ArgumentType(List.of(new ConverterVariant(converter)), false);
    }

    /**
     * Union 선언. 중첩된 union은 평탄화됩니다.
     *
     * @param types 변형 목록 (선언 순서 = 시도 순서)
     * @return ArgumentType
     * @throws IllegalArgumentException types가 비어 있는 경우
     */
    public static ArgumentType union(ArgumentType... types) {
        return new ArgumentType(flatten(types), false);
    }

    /**
     * Optional union 선언.
     *
     * <p>모든 변형이 실패하면 오류 대신 "값 없음"으로 처리됩니다.</p>
     *
     * @param types 변형 목록
     * @return ArgumentType
     * @throws IllegalArgumentException types가 비어 있는 경우
     */
    public static ArgumentType optional(ArgumentType... types) {
        return new ArgumentType(flatten(types), true);
    }

    private static List<Variant> flatten(ArgumentType... types) {
        if (types == null || types.length == 0) {
            throw new IllegalArgumentException("types cannot be empty");
        }
        List<Variant> flattened = new ArrayList<>();
        for (ArgumentType type : types) {
            if (type == null) {
                throw new IllegalArgumentException("types cannot contain null");
            }
            flattened.addAll(type.variants);
        }
        return flattened;
    }

    public List<Variant> getVariants() {
        return variants;
    }

    public boolean isOptional() {
        return optional;
    }

    /**
     * 단일 변형이며 optional이 아닌지 확인.
     *
     * @return union 처리가 필요 없으면 true
     */
    public boolean isSingle() {
        return variants.size() == 1 && !optional;
    }

    /**
     * 사람이 읽을 수 있는 타입 표현 (예: {@code Integer | String | None}).
     *
     * @return 타입 설명
     */
    public String describe() {
        String joined = variants.stream().map(Variant::describe).collect(Collectors.joining(" | "));
        return optional ? joined + " | None" : joined;
    }

    @Override
    public String toString() {
        return "ArgumentType{" + describe() + '}';
    }

    /**
     * 선언된 변형 하나.
     */
    public sealed interface Variant permits TypeVariant, ConverterVariant {

        String describe();
    }

    /**
     * 구체 타입 변형. 빌드 시점에 ConverterRegistry에서 변환기를 찾습니다.
     *
     * @param type 변환 대상 타입
     */
    public record TypeVariant(Class<?> type) implements Variant {

        @Override
        public String describe() {
            return type.getSimpleName();
        }
    }

    /**
     * 변환기를 직접 지정한 변형.
     *
     * @param converter 변환기
     */
    public record ConverterVariant(Converter<?> converter) implements Variant {

        @Override
        public String describe() {
            return converter.describe();
        }
    }
}
