package com.ryuqq.chatcommand.core.parse;

import com.ryuqq.chatcommand.core.context.BoundArguments;
import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.exception.BadArgument;
import com.ryuqq.chatcommand.core.exception.CommandException;
import com.ryuqq.chatcommand.core.exception.MissingRequiredArgument;
import com.ryuqq.chatcommand.core.exception.TooManyArguments;
import com.ryuqq.chatcommand.core.model.Parameter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 토큰을 파라미터에 바인딩하고 즉시 변환.
 *
 * <p>파라미터를 선언 순서대로 처리하며, 바인딩과 변환은 번갈아 수행됩니다.
 * 첫 번째 실패에서 중단하므로 뒤쪽 파라미터의 변환기는 호출되지 않습니다.</p>
 *
 * <p><strong>종류별 값 출처:</strong></p>
 * <ul>
 *   <li>POSITIONAL: 다음 positional 토큰 → 기본값 → {@link MissingRequiredArgument}</li>
 *   <li>SPECIAL: key로 조회 → 기본값 → {@link MissingRequiredArgument}</li>
 *   <li>CONSUME_REST: 원본 나머지 (비어 있으면 기본값 → {@link MissingRequiredArgument})</li>
 * </ul>
 *
 * <p>optional 타입에 값이 없고 기본값도 없으면 null로 바인딩됩니다.
 * optional union이 "값 없음"으로 끝난 positional 파라미터는 토큰을 소비하지 않습니다.
 * 그 토큰이 consume-rest 파라미터까지 남으면 나머지는 그 토큰의 offset부터 원본 그대로 구성됩니다.
 * 기본값은 변환하지 않고 그대로 사용합니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class ArgumentBinder {

    // Utility class - prevent instantiation
    private ArgumentBinder() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 바인딩 실행.
     *
     * @param context 현재 호출 컨텍스트 (변환기에 전달)
     * @param bindings 변환기가 확정된 파라미터 (선언 순서)
     * @param tokens 토큰화 결과
     * @param commandName 명령 이름 (오류 메시지용)
     * @param ignoreExtraArguments false이면 남는 positional 토큰을 {@link TooManyArguments}로 거부
     * @return 바인딩 결과
     * @throws CommandException 바인딩 또는 변환 실패
     * @throws InterruptedException 변환 중 인터럽트된 경우
     */
    public static BoundArguments bind(
        CommandContext context,
        List<ParameterBinding> bindings,
        TokenizedArguments tokens,
        String commandName,
        boolean ignoreExtraArguments
    ) throws InterruptedException {
        Map<String, Object> values = new LinkedHashMap<>();
        List<Token> positional = tokens.positional();
        int next = 0;

        for (ParameterBinding binding : bindings) {
            Parameter parameter = binding.parameter();
            switch (parameter.kind()) {
                case POSITIONAL -> {
                    if (next < positional.size()) {
                        Token token = positional.get(next);
                        Object value = convert(context, binding, token.value());
                        if (value == null && binding.isOptionalUnion()) {
                            values.put(parameter.name(), fallback(parameter));
                        } else {
                            values.put(parameter.name(), value);
                            next++;
                        }
                    } else {
                        values.put(parameter.name(), fallback(parameter));
                    }
                }
                case SPECIAL -> {
                    String raw = tokens.specials().get(parameter.name());
                    if (raw != null) {
                        values.put(parameter.name(), convert(context, binding, raw));
                    } else {
                        values.put(parameter.name(), fallback(parameter));
                    }
                }
                case CONSUME_REST -> {
                    String rest = tokens.rest();
                    if (next < positional.size()) {
                        // optional union이 넘긴 토큰부터 나머지를 다시 구성
                        rest = tokens.restFrom(positional.get(next).position());
                        next = positional.size();
                    }
                    if (rest != null && !rest.isEmpty()) {
                        values.put(parameter.name(), convert(context, binding, rest));
                    } else {
                        values.put(parameter.name(), fallback(parameter));
                    }
                }
            }
        }

        if (!ignoreExtraArguments && next < positional.size()) {
            throw new TooManyArguments(commandName, positional.get(next).position());
        }
        return BoundArguments.of(values);
    }

    private static Object fallback(Parameter parameter) {
        if (parameter.hasDefault()) {
            return parameter.defaultValue();
        }
        if (parameter.type().isOptional()) {
            return null;
        }
        throw new MissingRequiredArgument(parameter.name());
    }

    private static Object convert(CommandContext context, ParameterBinding binding, String raw)
        throws InterruptedException {
        String name = binding.name();
        try {
            return binding.converter().convert(context, raw);
        } catch (InterruptedException e) {
            throw e;
        } catch (BadArgument e) {
            throw e.forParameter(name);
        } catch (CommandException e) {
            throw e;
        } catch (Exception e) {
            throw new BadArgument(
                "Failed to convert \"" + raw + "\" for parameter \"" + name + "\": " + e.getMessage(), raw, name, e);
        }
    }
}
