package com.ryuqq.chatcommand.core.parse;

import com.ryuqq.chatcommand.core.convert.Converter;
import com.ryuqq.chatcommand.core.convert.UnionConverter;
import com.ryuqq.chatcommand.core.model.Parameter;

/**
 * 빌드 시점에 변환기가 확정된 파라미터.
 *
 * @param parameter 파라미터 선언
 * @param converter 확정된 변환기
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public record ParameterBinding(Parameter parameter, Converter<?> converter) {

    public ParameterBinding {
        if (parameter == null) {
            throw new IllegalArgumentException("parameter cannot be null");
        }
        if (converter == null) {
            throw new IllegalArgumentException("converter cannot be null");
        }
    }

    public String name() {
        return parameter.name();
    }

    /**
     * "값 없음" 변형이 있는 union인지 확인.
     *
     * @return optional union이면 true
     */
    public boolean isOptionalUnion() {
        return converter instanceof UnionConverter union && union.isOptional();
    }
}
