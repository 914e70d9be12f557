package com.ryuqq.chatcommand.core.convert;

import com.ryuqq.chatcommand.core.spi.EntityResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 선언 타입 → {@link Converter} 매핑.
 *
 * <p>명령 빌드 시점에 {@link #resolve(ArgumentType)}가 호출되어 각 파라미터의 변환기가 확정됩니다.
 * 호출 시점에는 타입 조회를 하지 않습니다.</p>
 *
 * <p><strong>기본 매핑 ({@link #withDefaults()}):</strong></p>
 * <ul>
 *   <li>String → {@link BuiltinConverters#STRING}</li>
 *   <li>Integer, int → {@link BuiltinConverters#INTEGER}</li>
 *   <li>Long, long → {@link BuiltinConverters#LONG}</li>
 *   <li>Double, double → {@link BuiltinConverters#DOUBLE}</li>
 *   <li>Boolean, boolean → {@link BuiltinConverters#BOOLEAN}</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 등록과 조회 모두 thread-safe합니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class ConverterRegistry {

    private final Map<Class<?>, Converter<?>> converters = new ConcurrentHashMap<>();

    private ConverterRegistry() {
    }

    /**
     * 빈 레지스트리 생성.
     *
     * @return ConverterRegistry
     */
    public static ConverterRegistry empty() {
        return new ConverterRegistry();
    }

    /**
     * 기본 변환기가 등록된 레지스트리 생성.
     *
     * @return ConverterRegistry
     */
    public static ConverterRegistry withDefaults() {
        ConverterRegistry registry = new ConverterRegistry();
        registry.register(String.class, BuiltinConverters.STRING);
        registry.register(Integer.class, BuiltinConverters.INTEGER);
        registry.register(int.class, BuiltinConverters.INTEGER);
        registry.register(Long.class, BuiltinConverters.LONG);
        registry.register(long.class, BuiltinConverters.LONG);
        registry.register(Double.class, BuiltinConverters.DOUBLE);
        registry.register(double.class, BuiltinConverters.DOUBLE);
        registry.register(Boolean.class, BuiltinConverters.BOOLEAN);
        registry.register(boolean.class, BuiltinConverters.BOOLEAN);
        return registry;
    }

    /**
     * 타입에 대한 변환기 등록 (기존 매핑은 교체).
     *
     * @param type 대상 타입
     * @param converter 변환기
     * @param <T> 대상 타입
     * @return this
     * @throws IllegalArgumentException type 또는 converter가 null인 경우
     */
    public <T> ConverterRegistry register(Class<T> type, Converter<? extends T> converter) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (converter == null) {
            throw new IllegalArgumentException("converter cannot be null");
        }
        converters.put(type, converter);
        return this;
    }

    /**
     * 외부 엔티티 타입 등록.
     *
     * @param type 엔티티 타입
     * @param resolver 엔티티 조회기
     * @param <E> 엔티티 타입
     * @return this
     */
    public <E> ConverterRegistry registerEntity(Class<E> type, EntityResolver<E> resolver) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return register(type, new EntityConverter<>(type.getSimpleName(), resolver));
    }

    /**
     * 타입에 등록된 변환기 조회.
     *
     * @param type 대상 타입
     * @return 변환기 (없으면 empty)
     */
    public Optional<Converter<?>> find(Class<?> type) {
        return Optional.ofNullable(converters.get(type));
    }

    /**
     * 선언 타입을 실행 가능한 변환기로 확정.
     *
     * <p>단일 변형이면 해당 변환기를, 그렇지 않으면 {@link UnionConverter}를 반환합니다.</p>
     *
     * @param type 선언 타입
     * @return 변환기
     * @throws IllegalArgumentException 등록되지 않은 타입이 포함된 경우
     */
    public Converter<?> resolve(ArgumentType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        List<Converter<?>> resolved = new ArrayList<>(type.getVariants().size());
        for (ArgumentType.Variant variant : type.getVariants()) {
            resolved.add(resolveVariant(variant));
        }
        if (type.isSingle()) {
            return resolved.get(0);
        }
        return new UnionConverter(resolved, type.isOptional());
    }

    private Converter<?> resolveVariant(ArgumentType.Variant variant) {
        if (variant instanceof ArgumentType.ConverterVariant converterVariant) {
            return converterVariant.converter();
        }
        Class<?> target = ((ArgumentType.TypeVariant) variant).type();
        Converter<?> converter = converters.get(target);
        if (converter == null) {
            throw new IllegalArgumentException("No converter registered for type " + target.getName());
        }
        return converter;
    }
}
