package com.ryuqq.chatcommand.core.guard;

import com.ryuqq.chatcommand.core.context.CommandContext;

/**
 * 호출 허용 여부를 판단하는 조건.
 *
 * <p>인자 바인딩이 끝난 뒤 실행되며, 외부 조회를 위해 블로킹할 수 있습니다.
 * false를 반환하면 {@code CheckFailure}로 거부되고, 직접 {@code CheckFailure}를 던져
 * 메시지를 지정할 수도 있습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Guard.named("subscriber-only", ctx -&gt; subscriptions.isSubscribed(ctx.chatter().id()));
 * </pre>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Guard {

    /**
     * 조건 검사.
     *
     * @param context 현재 호출 컨텍스트 (인자 바인딩 완료 상태)
     * @return 허용이면 true
     * @throws Exception 검사 실패 (CheckFailure 외의 예외는 CheckFailure로 감싸짐)
     */
    boolean test(CommandContext context) throws Exception;

    /**
     * Guard 이름 ({@code CheckFailure#getGuardName()}에 사용).
     *
     * @return 이름
     */
    default String name() {
        Class<?> type = getClass();
        return type.isSynthetic() ? "guard" : type.getSimpleName();
    }

    /**
     * false 반환 시 사용할 메시지.
     *
     * @return 메시지
     */
    default String failureMessage() {
        return "The check \"" + name() + "\" failed.";
    }

    /**
     * 이름을 붙인 Guard 생성.
     *
     * @param name Guard 이름
     * @param predicate 조건
     * @return Guard
     * @throws IllegalArgumentException name이 비어 있거나 predicate가 null인 경우
     */
    static Guard named(String name, Guard predicate) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        return new Guard() {
            @Override
            public boolean test(CommandContext context) throws Exception {
                return predicate.test(context);
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
