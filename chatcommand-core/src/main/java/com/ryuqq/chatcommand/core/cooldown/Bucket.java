package com.ryuqq.chatcommand.core.cooldown;

import com.ryuqq.chatcommand.core.context.CommandContext;

/**
 * Cooldown 상태를 나누는 키 추출 규칙.
 *
 * <p>순수 함수여야 합니다. null을 반환하면 해당 호출은 이 cooldown을 우회합니다.
 * 반환 값은 {@code equals/hashCode}가 올바르게 구현된 값이어야 합니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 * @see BucketType
 */
@FunctionalInterface
public interface Bucket {

    /**
     * @param context 현재 호출 컨텍스트
     * @return 상태 키 (null이면 cooldown 우회)
     */
    Object key(CommandContext context);
}
