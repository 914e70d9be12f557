package com.ryuqq.chatcommand.core.exception;

import java.util.List;

/**
 * Union 타입의 모든 변형(variant)이 변환에 실패함.
 *
 * <p>각 변형의 실패 사유를 선언 순서대로 보관합니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public class ConversionError extends BadArgument {

    private final List<String> reasons;

    public ConversionError(String value, List<String> reasons) {
        super("Failed to convert \"" + value + "\" to any of the declared types: " + String.join("; ", reasons), value);
        this.reasons = List.copyOf(reasons);
    }

    private ConversionError(ConversionError source, String parameterName) {
        super(source, parameterName);
        this.reasons = source.reasons;
    }

    @Override
    protected ConversionError withParameterName(String parameterName) {
        return new ConversionError(this, parameterName);
    }

    /**
     * 변형별 실패 사유 (선언 순서).
     *
     * @return 불변 리스트
     */
    public List<String> getReasons() {
        return reasons;
    }
}
