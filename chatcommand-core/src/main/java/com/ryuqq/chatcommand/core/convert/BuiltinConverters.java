package com.ryuqq.chatcommand.core.convert;

import com.ryuqq.chatcommand.core.exception.BadArgument;

import java.util.Locale;
import java.util.Set;

/**
 * 기본 제공 변환기.
 *
 * <ul>
 *   <li>{@link #STRING}: 그대로 반환</li>
 *   <li>{@link #INTEGER}, {@link #LONG}: 10진수, 앞뒤 공백 제거</li>
 *   <li>{@link #DOUBLE}: 소수, 앞뒤 공백 제거 (NaN/Infinity 불가)</li>
 *   <li>{@link #BOOLEAN}: 대소문자 무시, {@code true/yes/1/y}, {@code false/no/0/n}</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class BuiltinConverters {

    private static final Set<String> AFFIRMATIVE = Set.of("true", "yes", "1", "y");
    private static final Set<String> NEGATIVE = Set.of("false", "no", "0", "n");

    public static final Converter<String> STRING = new FunctionConverter<>("String", (context, raw) -> raw);

    public static final Converter<Integer> INTEGER = new FunctionConverter<>("Integer", (context, raw) -> {
        try {
            return Integer.parseInt(raw.trim(), 10);
        } catch (NumberFormatException e) {
            throw new BadArgument("\"" + raw + "\" is not a valid integer", raw, e);
        }
    });

    public static final Converter<Long> LONG = new FunctionConverter<>("Long", (context, raw) -> {
        try {
            return Long.parseLong(raw.trim(), 10);
        } catch (NumberFormatException e) {
            throw new BadArgument("\"" + raw + "\" is not a valid integer", raw, e);
        }
    });

    public static final Converter<Double> DOUBLE = new FunctionConverter<>("Double", (context, raw) -> {
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new BadArgument("\"" + raw + "\" is not a valid number", raw, e);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new BadArgument("\"" + raw + "\" is not a finite number", raw);
        }
        return value;
    });

    public static final Converter<Boolean> BOOLEAN = new FunctionConverter<>("Boolean", (context, raw) -> {
        String lowered = raw.trim().toLowerCase(Locale.ROOT);
        if (AFFIRMATIVE.contains(lowered)) {
            return Boolean.TRUE;
        }
        if (NEGATIVE.contains(lowered)) {
            return Boolean.FALSE;
        }
        throw new BadArgument("\"" + raw + "\" is not a recognised boolean option", raw);
    });

    // Utility class - prevent instantiation
    private BuiltinConverters() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
