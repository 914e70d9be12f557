package com.ryuqq.chatcommand.core.convert;

import com.ryuqq.chatcommand.core.context.CommandContext;

/**
 * 함수 하나로 구성된 변환기.
 *
 * @param <T> 결과 타입
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class FunctionConverter<T> implements Converter<T> {

    private final String name;
    private final Converter<T> function;

    public FunctionConverter(String name, Converter<T> function) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        this.name = name;
        this.function = function;
    }

    @Override
    public T convert(CommandContext context, String raw) throws Exception {
        return function.convert(context, raw);
    }

    @Override
    public String describe() {
        return name;
    }

    @Override
    public String toString() {
        return "FunctionConverter{" + name + '}';
    }
}
