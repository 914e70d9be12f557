package com.ryuqq.chatcommand.core.convert;

import com.ryuqq.chatcommand.core.context.CommandContext;

/**
 * 원본 토큰을 타입이 있는 값으로 변환.
 *
 * <p>두 가지 형태로 사용합니다:</p>
 * <ul>
 *   <li><strong>함수형:</strong> {@link #named(String, Converter)}로 람다를 감싼 {@link FunctionConverter}</li>
 *   <li><strong>클래스형:</strong> 이 인터페이스를 직접 구현한 클래스 (상태를 갖거나 여러 단계가 필요한 변환)</li>
 * </ul>
 *
 * <p>변환에 실패하면 {@code BadArgument}를 던지는 것을 권장합니다.
 * 그 외 예외는 바인더가 {@code BadArgument}로 감쌉니다.
 * {@link InterruptedException}은 취소로 처리되며 감싸지 않습니다.</p>
 *
 * <p>반환값 null은 "값 없음"으로 취급됩니다.</p>
 *
 * @param <T> 변환 결과 타입
 * @author ChatCommand Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Converter<T> {

    /**
     * 변환 실행.
     *
     * @param context 현재 호출 컨텍스트
     * @param raw 원본 문자열
     * @return 변환된 값
     * @throws Exception 변환 실패 시
     */
    T convert(CommandContext context, String raw) throws Exception;

    /**
     * 오류 메시지에 쓰이는 변환기 이름.
     *
     * @return 이름
     */
    default String describe() {
        Class<?> type = getClass();
        return type.isSynthetic() ? "converter" : type.getSimpleName();
    }

    /**
     * 이름이 있는 함수형 변환기 생성.
     *
     * @param name 변환기 이름
     * @param function 변환 함수
     * @param <T> 결과 타입
     * @return FunctionConverter
     */
    static <T> Converter<T> named(String name, Converter<T> function) {
        return new FunctionConverter<>(name, function);
    }
}
